package com.infomedia.abacox.callbilling.component.calltracking;

import com.infomedia.abacox.callbilling.component.callevents.CallAnsweredEvent;
import com.infomedia.abacox.callbilling.component.callevents.CallCreatedEvent;
import com.infomedia.abacox.callbilling.component.rating.RatedResult;
import com.infomedia.abacox.callbilling.component.settlement.BillingAuthorization;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Typed partial update of an {@link ActiveCall}. Null fields leave the current value alone;
 * an UNKNOWN direction never overwrites a known one.
 */
@Value
@Builder
public class ActiveCallUpdate {
    String callerNumber;
    String calleeNumber;
    CallDirection direction;
    CallState state;
    Instant startTime;
    Instant answerTime;
    Long durationSeconds;
    BigDecimal currentCost;
    String connectionId;
    Long accountId;
    RatedResult quote;
    Boolean reserved;
    BigDecimal heldAmount;
    String rejectionReason;
    Boolean billingChecked;

    public static ActiveCallUpdate fromCreated(CallCreatedEvent event) {
        return ActiveCallUpdate.builder()
                .callerNumber(event.getCallerNumber())
                .calleeNumber(event.getCalleeNumber())
                .direction(event.getDirection())
                .startTime(event.getStartTime())
                .connectionId(event.getConnectionId())
                .build();
    }

    public static ActiveCallUpdate fromAnswered(CallAnsweredEvent event) {
        return ActiveCallUpdate.builder()
                .state(CallState.ANSWERED)
                .answerTime(event.getAnswerTime())
                .build();
    }

    public static ActiveCallUpdate fromAuthorization(BillingAuthorization authorization) {
        return ActiveCallUpdate.builder()
                .accountId(authorization.getAccountId())
                .quote(authorization.getQuote())
                .reserved(authorization.isReserved())
                .heldAmount(authorization.getHeldAmount())
                .rejectionReason(authorization.getRejectionReason())
                .billingChecked(true)
                .build();
    }

    public ActiveCall applyTo(ActiveCall current) {
        ActiveCall.ActiveCallBuilder merged = current.toBuilder();
        if (callerNumber != null) merged.callerNumber(callerNumber);
        if (calleeNumber != null) merged.calleeNumber(calleeNumber);
        if (direction != null && (direction != CallDirection.UNKNOWN || current.getDirection() == null)) {
            merged.direction(direction);
        }
        if (state != null) merged.state(state);
        if (startTime != null) merged.startTime(startTime);
        if (answerTime != null) merged.answerTime(answerTime);
        if (durationSeconds != null) merged.durationSeconds(durationSeconds);
        if (currentCost != null) merged.currentCost(currentCost);
        if (connectionId != null) merged.connectionId(connectionId);
        if (accountId != null) merged.accountId(accountId);
        if (quote != null) merged.quote(quote);
        if (reserved != null) merged.reserved(reserved);
        if (heldAmount != null) merged.heldAmount(heldAmount);
        if (rejectionReason != null) merged.rejectionReason(rejectionReason);
        if (billingChecked != null) merged.billingChecked(billingChecked);
        return merged.build();
    }
}
