package com.infomedia.abacox.callbilling.component.eventsocket;

import lombok.Getter;

/**
 * The switch rejected the shared secret.
 */
@Getter
public class AuthenticationException extends EventSocketException {

    private final String replyText;

    public AuthenticationException(String replyText) {
        super("Event socket authentication rejected: " + replyText);
        this.replyText = replyText;
    }
}
