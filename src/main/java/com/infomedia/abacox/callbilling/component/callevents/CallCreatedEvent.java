package com.infomedia.abacox.callbilling.component.callevents;

import com.infomedia.abacox.callbilling.component.calltracking.CallDirection;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CallCreatedEvent {
    String callId;
    String callerNumber;
    String calleeNumber;
    CallDirection direction;
    Instant startTime;
    String connectionId;
}
