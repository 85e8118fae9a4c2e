package com.infomedia.abacox.callbilling.component.eventsocket;

import java.util.List;

/**
 * Receives event frames in arrival order from the connection's reading thread.
 * Implementations must not block for long: a slow listener stalls the socket.
 */
@FunctionalInterface
public interface EventSocketListener {

    void onEvent(EslFrame frame);

    /**
     * Event names requested from the switch after authentication.
     */
    default List<String> subscribedEvents() {
        return List.of("ALL");
    }
}
