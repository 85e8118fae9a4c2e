package com.infomedia.abacox.callbilling.component.calltracking;

import java.util.Locale;

public enum CallDirection {
    INBOUND,
    OUTBOUND,
    INTERNAL,
    TRANSIT,
    UNKNOWN;

    /**
     * Lenient mapping of the switch's {@code Call-Direction} value. Anything unrecognised is UNKNOWN.
     */
    public static CallDirection parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
