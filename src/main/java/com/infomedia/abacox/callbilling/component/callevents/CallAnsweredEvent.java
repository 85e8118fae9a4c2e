package com.infomedia.abacox.callbilling.component.callevents;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CallAnsweredEvent {
    String callId;
    Instant answerTime;
}
