package com.infomedia.abacox.callbilling.component.eventsocket;

/**
 * Malformed frame, unexpected reply or a timed out read. The stream position is unknown
 * after one of these, so the session must be dropped.
 */
public class ProtocolException extends EventSocketException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
