package com.infomedia.abacox.callbilling.component.eventsocket;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

/**
 * Sends call control commands over whichever session is currently listening. The client
 * attaches each session when it connects and detaches it when the connection ends; with no
 * session attached, commands are dropped with a warning.
 */
@Component
@Log4j2
public class EventSocketCommandChannel {

    private volatile EventSocketSession session;

    void attach(EventSocketSession session) {
        this.session = session;
    }

    void detach(EventSocketSession session) {
        if (this.session == session) {
            this.session = null;
        }
    }

    public boolean isAvailable() {
        EventSocketSession current = session;
        return current != null && current.getState() == SessionState.LISTENING;
    }

    /**
     * Asks the switch to tear the call down with the given hangup cause.
     *
     * @return true when the command was written
     */
    public boolean hangup(String callId, String cause) {
        if (callId == null || callId.isBlank() || callId.chars().anyMatch(Character::isWhitespace)) {
            log.warn("Refusing to hang up call with invalid id '{}'", callId);
            return false;
        }
        return api("uuid_kill " + callId + " " + cause);
    }

    boolean api(String command) {
        EventSocketSession current = session;
        if (current == null || current.getState() != SessionState.LISTENING) {
            log.warn("No event socket session to send '{}'", command);
            return false;
        }
        try {
            current.sendApi(command);
            log.info("Sent '{}' to the switch", command);
            return true;
        } catch (ConnectionException | IllegalStateException e) {
            log.warn("Could not send '{}': {}", command, e.getMessage());
            return false;
        }
    }
}
