package com.infomedia.abacox.callbilling.component.eventsocket;

/**
 * Transport level failure: refused connection, reset, or the switch closing the stream.
 */
public class ConnectionException extends EventSocketException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
