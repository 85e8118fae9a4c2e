package com.infomedia.abacox.callbilling.db.entity;

public enum AccountStatus {
    ACTIVE,
    SUSPENDED,
    CLOSED
}
