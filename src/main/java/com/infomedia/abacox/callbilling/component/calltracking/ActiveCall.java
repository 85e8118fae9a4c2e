package com.infomedia.abacox.callbilling.component.calltracking;

import com.infomedia.abacox.callbilling.component.callevents.CallEndedEvent;
import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * In-memory record of a call in progress. Immutable: the tracker replaces it through
 * {@link ActiveCallUpdate#applyTo(ActiveCall)}.
 */
@Value
@Builder(toBuilder = true)
public class ActiveCall {
    String callId;
    String callerNumber;
    String calleeNumber;
    CallDirection direction;
    CallState state;
    Instant startTime;
    Instant answerTime;
    long durationSeconds;
    BigDecimal currentCost;
    String connectionId;

    /** Account the call is billed to; null when unbilled. */
    Long accountId;
    /** Tariff quoted at call start. */
    RatedResult quote;
    /** True once a hold exists in the ledger for this call. */
    boolean reserved;
    /** Current size of the ledger hold; grows when the hold is extended. */
    BigDecimal heldAmount;
    /** Why the reservation was refused; non-null marks the call rejected. */
    String rejectionReason;
    /** Authorization already ran for this call. */
    boolean billingChecked;

    public static ActiveCall ringing(String callId, Instant startTime) {
        return ActiveCall.builder()
                .callId(callId)
                .direction(CallDirection.UNKNOWN)
                .state(CallState.RINGING)
                .startTime(startTime)
                .currentCost(BigDecimal.ZERO)
                .build();
    }

    /**
     * Best-effort record for a call whose start this process never saw.
     */
    public static ActiveCall fromEnded(CallEndedEvent event) {
        return ActiveCall.builder()
                .callId(event.getCallId())
                .callerNumber(event.getCallerNumber())
                .calleeNumber(event.getCalleeNumber())
                .direction(event.getDirection() != null ? event.getDirection() : CallDirection.UNKNOWN)
                .state(event.getAnswerTime() != null ? CallState.ANSWERED : CallState.RINGING)
                .startTime(event.getStartTime())
                .answerTime(event.getAnswerTime())
                .durationSeconds(event.getDurationSeconds())
                .currentCost(BigDecimal.ZERO)
                .connectionId(event.getConnectionId())
                .build();
    }

    public boolean isRejected() {
        return rejectionReason != null;
    }
}
