package com.infomedia.abacox.callbilling.component.callevents;

import com.infomedia.abacox.callbilling.component.calltracking.CallDirection;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Final figures for a call as reported by the switch. Caller, callee, direction and start time
 * are carried so a call that was never tracked (created before this process attached) can still
 * be settled.
 */
@Value
@Builder(toBuilder = true)
public class CallEndedEvent {
    String callId;
    Instant endTime;
    long durationSeconds;
    long billableSeconds;
    /** The switch sent no billsec; billableSeconds was derived from the answer and end times. */
    boolean billsecMissing;
    String hangupCause;
    String callerNumber;
    String calleeNumber;
    CallDirection direction;
    Instant startTime;
    Instant answerTime;
    String connectionId;
}
