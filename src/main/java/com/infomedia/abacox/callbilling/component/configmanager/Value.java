package com.infomedia.abacox.callbilling.component.configmanager;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class Value {

    private String key;

    private String value;

    private String getErrorMessage(String targetType) {
        return String.format("Configuration value '%s' for key '%s' cannot be converted to %s.", value, key, targetType);
    }

    public Integer asInteger() {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(getErrorMessage("Integer"), e);
        }
    }

    public Long asLong() {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(getErrorMessage("Long"), e);
        }
    }

    public Boolean asBoolean() {
        return Boolean.parseBoolean(value != null ? value.trim() : null);
    }

    public BigDecimal asBigDecimal() {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(getErrorMessage("BigDecimal"), e);
        }
    }

    public Duration asDuration() {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException(getErrorMessage("Duration (ISO-8601 format)"), e);
        }
    }

    public <E extends Enum<E>> E asEnum(Class<E> enumType) {
        try {
            return Enum.valueOf(enumType, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException(getErrorMessage(enumType.getSimpleName()), e);
        }
    }

    public String asString() {
        return value;
    }
}
