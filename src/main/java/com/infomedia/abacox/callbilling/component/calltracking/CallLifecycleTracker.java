package com.infomedia.abacox.callbilling.component.calltracking;

import com.infomedia.abacox.callbilling.component.callevents.CallAnsweredEvent;
import com.infomedia.abacox.callbilling.component.callevents.CallCreatedEvent;
import com.infomedia.abacox.callbilling.component.callevents.CallEndedEvent;
import com.infomedia.abacox.callbilling.component.callevents.CallEventMapper;
import com.infomedia.abacox.callbilling.component.callevents.CallWorkerPool;
import com.infomedia.abacox.callbilling.component.configmanager.ConfigKey;
import com.infomedia.abacox.callbilling.component.configmanager.ConfigService;
import com.infomedia.abacox.callbilling.component.eventsocket.EventSocketCommandChannel;
import com.infomedia.abacox.callbilling.component.rating.CostCalculator;
import com.infomedia.abacox.callbilling.component.settlement.BillingAuthorization;
import com.infomedia.abacox.callbilling.component.settlement.CallBillingService;
import com.infomedia.abacox.callbilling.config.CallBillingProperties;
import com.infomedia.abacox.callbilling.db.entity.CallDetailRecord;
import com.infomedia.abacox.callbilling.dto.activecall.ActiveCallSnapshot;
import com.infomedia.abacox.callbilling.service.remote.DashboardGatewayService;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of calls in progress. Handlers run on the call's worker lane, so two events of one
 * call never race; the map itself is shared with queries and the snapshot refresher.
 * <p>
 * Dashboard updates are only queued here; the gateway sends them from its own thread.
 */
@Component
@Log4j2
public class CallLifecycleTracker {

    static final String REJECTED_HANGUP_CAUSE = "CALL_REJECTED";

    private final Map<String, ActiveCall> calls = new ConcurrentHashMap<>();
    private final Map<String, Boolean> recentlyEnded;
    /** Calls with a refresh waiting on their lane. */
    private final Set<String> refreshPending = ConcurrentHashMap.newKeySet();

    private final CallBillingService billingService;
    private final DashboardGatewayService gatewayService;
    private final CallWorkerPool workerPool;
    private final EventSocketCommandChannel commandChannel;
    private final ConfigService configService;
    private final Clock clock;

    public CallLifecycleTracker(CallBillingService billingService, DashboardGatewayService gatewayService,
                                CallWorkerPool workerPool, EventSocketCommandChannel commandChannel,
                                ConfigService configService, Clock clock, CallBillingProperties properties) {
        this.billingService = billingService;
        this.gatewayService = gatewayService;
        this.workerPool = workerPool;
        this.commandChannel = commandChannel;
        this.configService = configService;
        this.clock = clock;
        int capacity = Math.max(1, properties.getTracker().getRecentlyEndedCapacity());
        this.recentlyEnded = Collections.synchronizedMap(new LinkedHashMap<>(256, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        });
    }

    /**
     * Inserts the call as ringing, or merges into the existing record. Authorization runs once
     * per call, the first time it is created; a rejected call is hung up on the switch unless
     * {@link ConfigKey#HANGUP_REJECTED_CALLS} is off.
     */
    public ActiveCall onCreate(CallCreatedEvent event) {
        String callId = event.getCallId();
        if (recentlyEnded.containsKey(callId)) {
            log.debug("Ignoring create for already ended call {}", callId);
            return null;
        }
        ActiveCallUpdate update = ActiveCallUpdate.fromCreated(event);
        ActiveCall call = calls.compute(callId, (id, current) ->
                update.applyTo(current != null ? current : ActiveCall.ringing(id, event.getStartTime())));

        if (!call.isBillingChecked()) {
            try {
                BillingAuthorization authorization = billingService.authorize(call);
                ActiveCallUpdate authorized = ActiveCallUpdate.fromAuthorization(authorization);
                call = calls.computeIfPresent(callId, (id, current) -> authorized.applyTo(current));
                if (authorization.isRejected()) {
                    log.info("Call {} from {} rejected: {}", callId, event.getCallerNumber(), authorization.getRejectionReason());
                    if (configService.getValue(ConfigKey.HANGUP_REJECTED_CALLS).asBoolean()) {
                        commandChannel.hangup(callId, REJECTED_HANGUP_CAUSE);
                    }
                }
            } catch (RuntimeException e) {
                log.error("Authorization failed for call {}; it will be billed when it ends", callId, e);
            }
        }

        if (call != null) {
            log.debug("Tracking call {} ({} -> {}, {})", callId, call.getCallerNumber(), call.getCalleeNumber(), call.getDirection());
            gatewayService.publishActiveCall(toSnapshot(call));
        }
        return call;
    }

    public ActiveCall onAnswer(CallAnsweredEvent event) {
        ActiveCallUpdate update = ActiveCallUpdate.fromAnswered(event);
        ActiveCall call = calls.computeIfPresent(event.getCallId(), (id, current) -> update.applyTo(current));
        if (call == null) {
            log.warn("Answer for unknown call {}; it may have started before this process attached", event.getCallId());
            return null;
        }
        gatewayService.publishActiveCall(toSnapshot(call));
        return call;
    }

    /**
     * Removes the call and settles it. A second END for the same call is a no-op; an END for a
     * call never seen is settled from the END event alone. When the switch sent no billsec, the
     * billable time runs from the tracked answer to the end.
     */
    public CallDetailRecord onEnd(CallEndedEvent event) {
        String callId = event.getCallId();
        ActiveCall call = calls.remove(callId);
        if (call == null) {
            if (recentlyEnded.containsKey(callId)) {
                log.debug("Duplicate end for call {}", callId);
                return null;
            }
            log.warn("End for untracked call {}; settling from the end event", callId);
            call = ActiveCall.fromEnded(event);
        }
        recentlyEnded.put(callId, Boolean.TRUE);
        refreshPending.remove(callId);
        gatewayService.publishRemoval(callId);

        CallEndedEvent end = event;
        if (event.isBillsecMissing() && call.getAnswerTime() != null && event.getEndTime() != null) {
            end = event.toBuilder()
                    .billableSeconds(CallEventMapper.secondsBetween(call.getAnswerTime(), event.getEndTime()))
                    .build();
            log.debug("No billsec for call {}; billing {}s from answer", callId, end.getBillableSeconds());
        }
        ActiveCall finished = completeFrom(call, end);
        try {
            return billingService.settle(finished, end);
        } catch (RuntimeException e) {
            log.error("Settlement failed for call {}", callId, e);
            return null;
        }
    }

    public Optional<ActiveCall> find(String callId) {
        return Optional.ofNullable(calls.get(callId));
    }

    public List<ActiveCall> activeCalls() {
        List<ActiveCall> snapshot = new ArrayList<>(calls.values());
        snapshot.sort(Comparator.comparing(ActiveCall::getStartTime, Comparator.nullsLast(Comparator.naturalOrder())));
        return snapshot;
    }

    public int size() {
        return calls.size();
    }

    /**
     * Refreshes answered calls: grows holds that are running out and republishes the running
     * duration and cost. Each refresh runs on the call's lane so it cannot overwrite a concurrent
     * answer or end; a call whose previous refresh has not run yet is skipped.
     */
    @Scheduled(fixedDelayString = "${callbilling.tracker.snapshot-interval:PT5S}",
            initialDelayString = "${callbilling.tracker.snapshot-interval:PT5S}")
    public void refreshSnapshots() {
        for (ActiveCall call : calls.values()) {
            String callId = call.getCallId();
            if (call.getState() == CallState.ANSWERED && refreshPending.add(callId)) {
                workerPool.submit(callId, () -> refresh(callId));
            }
        }
    }

    void refresh(String callId) {
        refreshPending.remove(callId);
        ActiveCall current = calls.get(callId);
        if (current == null || current.getState() != CallState.ANSWERED) {
            return;
        }
        Instant now = clock.instant();
        BigDecimal held = current.getHeldAmount();
        if (current.isReserved()) {
            try {
                held = billingService.extendHold(current, now).orElse(held);
            } catch (RuntimeException e) {
                log.error("Hold extension failed for call {}", callId, e);
            }
        }
        BigDecimal heldAmount = held;
        ActiveCall updated = calls.computeIfPresent(callId, (id, call) ->
                withProgress(call.toBuilder().heldAmount(heldAmount).build(), now));
        if (updated != null && configService.getValue(ConfigKey.SNAPSHOT_REFRESH_ENABLED).asBoolean()) {
            gatewayService.publishActiveCall(toSnapshot(updated));
        }
    }

    static ActiveCall withProgress(ActiveCall call, Instant now) {
        long seconds = call.getAnswerTime() == null ? 0
                : Math.max(0, Duration.between(call.getAnswerTime(), now).getSeconds());
        BigDecimal cost = call.getQuote() == null ? BigDecimal.ZERO : CostCalculator.cost(call.getQuote(), seconds);
        return call.toBuilder().durationSeconds(seconds).currentCost(cost).build();
    }

    private static ActiveCall completeFrom(ActiveCall call, CallEndedEvent event) {
        ActiveCall.ActiveCallBuilder builder = call.toBuilder().durationSeconds(event.getDurationSeconds());
        if (call.getCallerNumber() == null) builder.callerNumber(event.getCallerNumber());
        if (call.getCalleeNumber() == null) builder.calleeNumber(event.getCalleeNumber());
        if (call.getAnswerTime() == null) builder.answerTime(event.getAnswerTime());
        if (call.getConnectionId() == null) builder.connectionId(event.getConnectionId());
        if (call.getDirection() == null || call.getDirection() == CallDirection.UNKNOWN) {
            if (event.getDirection() != null) builder.direction(event.getDirection());
        }
        return builder.build();
    }

    public static ActiveCallSnapshot toSnapshot(ActiveCall call) {
        return ActiveCallSnapshot.builder()
                .callId(call.getCallId())
                .callingNumber(call.getCallerNumber())
                .calledNumber(call.getCalleeNumber())
                .direction(call.getDirection() != null ? call.getDirection().name().toLowerCase(Locale.ROOT) : null)
                .status(call.getState() != null ? call.getState().name().toLowerCase(Locale.ROOT) : null)
                .startTime(call.getStartTime())
                .answerTime(call.getAnswerTime())
                .currentDuration(call.getDurationSeconds())
                .currentCost(call.getCurrentCost())
                .destinationName(call.getQuote() != null ? call.getQuote().getDestinationName() : null)
                .connectionId(call.getConnectionId())
                .build();
    }
}
