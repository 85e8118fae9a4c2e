package com.infomedia.abacox.callbilling.component.eventsocket;

/**
 * Base type for failures that end an event socket session. The client always closes the
 * connection on any of these and decides whether to reconnect from the concrete subtype.
 */
public abstract class EventSocketException extends Exception {

    protected EventSocketException(String message) {
        super(message);
    }

    protected EventSocketException(String message, Throwable cause) {
        super(message, cause);
    }
}
