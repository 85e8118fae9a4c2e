package com.infomedia.abacox.callbilling.component.callevents;

import com.infomedia.abacox.callbilling.component.calltracking.CallLifecycleTracker;
import com.infomedia.abacox.callbilling.component.eventsocket.EslFrame;
import com.infomedia.abacox.callbilling.component.eventsocket.EventSocketListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs on the socket reader thread. Frames are mapped in arrival order and handed to the
 * call's worker lane, which preserves that order per call id.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class CallEventDispatcher implements EventSocketListener {

    private final CallLifecycleTracker tracker;
    private final CallWorkerPool workerPool;
    private final Clock clock;

    @Override
    public List<String> subscribedEvents() {
        List<String> names = new ArrayList<>();
        for (CallEventKind kind : CallEventKind.values()) {
            names.addAll(kind.getEventNames());
        }
        names.add(CallEventKind.HEARTBEAT);
        return names;
    }

    @Override
    public void onEvent(EslFrame frame) {
        String eventName = frame.eventName();
        Optional<CallEventKind> kind = CallEventKind.fromEventName(eventName);
        if (kind.isEmpty()) {
            if (!CallEventKind.HEARTBEAT.equals(eventName)) {
                log.debug("Ignoring event {}", eventName);
            }
            return;
        }

        String callId = frame.get(CallEventMapper.UNIQUE_ID);
        if (callId == null || callId.isBlank()) {
            log.warn("Dropping {} event without {}", eventName, CallEventMapper.UNIQUE_ID);
            return;
        }

        Instant arrival = clock.instant();
        switch (kind.get()) {
            case CREATE -> {
                CallCreatedEvent event = CallEventMapper.toCreated(frame, arrival);
                workerPool.submit(callId, () -> tracker.onCreate(event));
            }
            case ANSWER -> {
                CallAnsweredEvent event = CallEventMapper.toAnswered(frame, arrival);
                workerPool.submit(callId, () -> tracker.onAnswer(event));
            }
            case END -> {
                CallEndedEvent event = CallEventMapper.toEnded(frame, arrival);
                workerPool.submit(callId, () -> tracker.onEnd(event));
            }
        }
        log.debug("Dispatched {} for call {}", eventName, callId);
    }
}
