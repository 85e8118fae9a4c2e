package com.infomedia.abacox.callbilling.exception;

/**
 * Base of the settlement ledger's business failures. These are per-call: callers log them and
 * move on, they never affect the event connection.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
