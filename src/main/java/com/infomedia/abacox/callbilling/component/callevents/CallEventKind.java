package com.infomedia.abacox.callbilling.component.callevents;

import java.util.List;
import java.util.Optional;

/**
 * Lifecycle kinds the billing core reacts to. A call ends on CHANNEL_HANGUP_COMPLETE, the first
 * hangup event that carries the final billsec; the earlier CHANNEL_HANGUP is not subscribed.
 */
public enum CallEventKind {
    CREATE("CHANNEL_CREATE"),
    ANSWER("CHANNEL_ANSWER"),
    END("CHANNEL_HANGUP_COMPLETE");

    public static final String HEARTBEAT = "HEARTBEAT";

    private final List<String> eventNames;

    CallEventKind(String... eventNames) {
        this.eventNames = List.of(eventNames);
    }

    public List<String> getEventNames() {
        return eventNames;
    }

    public static Optional<CallEventKind> fromEventName(String eventName) {
        if (eventName == null) {
            return Optional.empty();
        }
        for (CallEventKind kind : values()) {
            if (kind.eventNames.contains(eventName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
