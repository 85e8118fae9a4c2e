package com.infomedia.abacox.callbilling.component.eventsocket;

public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    AWAITING_CHALLENGE,
    AUTHENTICATING,
    SUBSCRIBING,
    LISTENING
}
