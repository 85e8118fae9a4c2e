package com.infomedia.abacox.callbilling.exception;

import lombok.Getter;

@Getter
public class DuplicateReservationException extends LedgerException {

    private final String callId;

    public DuplicateReservationException(String callId) {
        super("A reservation already exists for call " + callId);
        this.callId = callId;
    }
}
