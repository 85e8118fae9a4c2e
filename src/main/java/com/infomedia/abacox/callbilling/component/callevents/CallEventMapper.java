package com.infomedia.abacox.callbilling.component.callevents;

import com.infomedia.abacox.callbilling.component.calltracking.CallDirection;
import com.infomedia.abacox.callbilling.component.eventsocket.EslFrame;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;

/**
 * Turns raw event frames into typed lifecycle events. Missing or malformed values fall back
 * to defaults rather than failing: the switch omits fields on some legs.
 */
@Log4j2
public final class CallEventMapper {

    public static final String UNIQUE_ID = "Unique-ID";
    public static final String CORE_UUID = "Core-UUID";
    public static final String CALLER_NUMBER = "Caller-Caller-ID-Number";
    public static final String DESTINATION_NUMBER = "Caller-Destination-Number";
    public static final String CALL_DIRECTION = "Call-Direction";
    public static final String CREATED_TIME = "Caller-Channel-Created-Time";
    public static final String ANSWERED_TIME = "Caller-Channel-Answered-Time";
    public static final String EVENT_TIMESTAMP = "Event-Date-Timestamp";
    public static final String DURATION = "variable_duration";
    public static final String BILLSEC = "variable_billsec";
    public static final String HANGUP_CAUSE = "Hangup-Cause";

    private CallEventMapper() {
    }

    public static CallCreatedEvent toCreated(EslFrame frame, Instant arrival) {
        return CallCreatedEvent.builder()
                .callId(frame.get(UNIQUE_ID))
                .callerNumber(frame.get(CALLER_NUMBER))
                .calleeNumber(frame.get(DESTINATION_NUMBER))
                .direction(CallDirection.parse(frame.get(CALL_DIRECTION)))
                .startTime(parseMicros(frame.get(CREATED_TIME), arrival))
                .connectionId(frame.get(CORE_UUID))
                .build();
    }

    public static CallAnsweredEvent toAnswered(EslFrame frame, Instant arrival) {
        Instant eventTime = parseMicros(frame.get(EVENT_TIMESTAMP), arrival);
        return CallAnsweredEvent.builder()
                .callId(frame.get(UNIQUE_ID))
                .answerTime(parseMicros(frame.get(ANSWERED_TIME), eventTime))
                .build();
    }

    /**
     * Without a billsec header the billable time is counted from the answer time to the end,
     * and is zero for a call that was never answered.
     */
    public static CallEndedEvent toEnded(EslFrame frame, Instant arrival) {
        Instant endTime = parseMicros(frame.get(EVENT_TIMESTAMP), arrival);
        Instant answerTime = parseMicros(frame.get(ANSWERED_TIME), null);
        String billsec = frame.get(BILLSEC);
        boolean billsecMissing = billsec == null || billsec.isBlank();
        long billable = billsecMissing ? secondsBetween(answerTime, endTime) : parseSeconds(billsec);
        return CallEndedEvent.builder()
                .callId(frame.get(UNIQUE_ID))
                .endTime(endTime)
                .durationSeconds(parseSeconds(frame.get(DURATION)))
                .billableSeconds(billable)
                .billsecMissing(billsecMissing)
                .hangupCause(frame.get(HANGUP_CAUSE))
                .callerNumber(frame.get(CALLER_NUMBER))
                .calleeNumber(frame.get(DESTINATION_NUMBER))
                .direction(CallDirection.parse(frame.get(CALL_DIRECTION)))
                .startTime(parseMicros(frame.get(CREATED_TIME), null))
                .answerTime(answerTime)
                .connectionId(frame.get(CORE_UUID))
                .build();
    }

    /**
     * The switch reports times as epoch microseconds; 0 means "not set".
     */
    static Instant parseMicros(String value, Instant fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            long micros = Long.parseLong(value.trim());
            if (micros <= 0) {
                return fallback;
            }
            return Instant.ofEpochSecond(micros / 1_000_000L, (micros % 1_000_000L) * 1_000L);
        } catch (NumberFormatException e) {
            log.debug("Unparseable timestamp '{}', using fallback", value);
            return fallback;
        }
    }

    public static long secondsBetween(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0;
        }
        return Math.max(0, Duration.between(from, to).getSeconds());
    }

    static long parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Unparseable duration '{}', using 0", value);
            return 0;
        }
    }
}
