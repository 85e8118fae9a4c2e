package com.infomedia.abacox.callbilling.exception;

import lombok.Getter;

/**
 * A ledger write kept failing after every retry. Nothing from the failed attempts was committed.
 */
@Getter
public class LedgerWriteException extends LedgerException {

    private final int attempts;

    public LedgerWriteException(String operation, int attempts, Throwable cause) {
        super(String.format("Ledger write '%s' failed after %d attempt(s)", operation, attempts), cause);
        this.attempts = attempts;
    }
}
