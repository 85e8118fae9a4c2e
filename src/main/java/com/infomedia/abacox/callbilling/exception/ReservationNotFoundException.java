package com.infomedia.abacox.callbilling.exception;

import lombok.Getter;

@Getter
public class ReservationNotFoundException extends LedgerException {

    private final String callId;

    public ReservationNotFoundException(String callId, String detail) {
        super("No active reservation for call " + callId + ": " + detail);
        this.callId = callId;
    }
}
