package com.infomedia.abacox.callbilling.db.entity;

public enum ReservationStatus {
    ACTIVE,
    COMMITTED,
    RELEASED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
