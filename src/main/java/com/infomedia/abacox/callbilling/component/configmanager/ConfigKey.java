package com.infomedia.abacox.callbilling.component.configmanager;

import lombok.Getter;

/**
 * Billing policy keys stored in the database. Each key holds its default value so the
 * application can always run with an empty config table.
 */
@Getter
public enum ConfigKey {

    // --- Reservations ---
    RESERVATION_SECONDS("300"), // hold size, in seconds of talk time at the quoted rate
    RESERVATION_TTL_MINUTES("240"),
    HOLD_EXTENSION_THRESHOLD_SECONDS("60"), // grow the hold when less talk time than this is left
    HOLD_EXTENSION_SECONDS("180"),

    // --- Rating policy ---
    UNRATED_POLICY(UnratedPolicy.ALLOW_ZERO.name()),
    BILL_INBOUND("false"),
    HANGUP_REJECTED_CALLS("true"),

    // --- Active call mirror ---
    SNAPSHOT_REFRESH_ENABLED("true");

    private final String defaultValue;

    ConfigKey(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    /**
     * Converts the enum's name from UPPER_SNAKE_CASE to lowerCamelCase.
     * For example, RESERVATION_TTL_MINUTES becomes reservationTtlMinutes.
     */
    public String getKey() {
        String[] parts = this.name().toLowerCase().split("_");
        if (parts.length == 1) {
            return parts[0];
        }
        StringBuilder camelCaseString = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            camelCaseString.append(Character.toUpperCase(part.charAt(0)))
                    .append(part.substring(1));
        }
        return camelCaseString.toString();
    }
}
