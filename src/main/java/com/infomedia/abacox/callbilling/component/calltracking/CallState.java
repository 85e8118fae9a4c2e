package com.infomedia.abacox.callbilling.component.calltracking;

public enum CallState {
    RINGING,
    ANSWERED
}
