package com.infomedia.abacox.callbilling.component.rating;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The one cost formula used everywhere:
 * <pre>
 * cost = connection_fee + rate_per_minute / 60 * ceil(billable / increment) * increment
 * </pre>
 * rounded to 4 decimals HALF_UP.
 * <p>
 * A call with zero billable seconds costs nothing, connection fee included, although the
 * formula alone would give the fee. Unanswered calls are never charged.
 */
public final class CostCalculator {

    public static final int SCALE = 4;
    private static final BigDecimal SECONDS_PER_MINUTE = BigDecimal.valueOf(60);

    private CostCalculator() {
    }

    public static BigDecimal cost(RatedResult rated, long billableSeconds) {
        if (billableSeconds <= 0 || rated == null) {
            return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        }
        return nonNull(rated.getConnectionFee()).add(rawUsage(rated, billableSeconds)).setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Per-minute part of the cost only, without the connection fee. Used to size hold extensions.
     */
    public static BigDecimal usage(RatedResult rated, long seconds) {
        if (seconds <= 0 || rated == null) {
            return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        }
        return rawUsage(rated, seconds).setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Hold amount for a call expected to last {@code seconds}.
     */
    public static BigDecimal estimate(RatedResult rated, long seconds) {
        return cost(rated, Math.max(1, seconds));
    }

    private static BigDecimal rawUsage(RatedResult rated, long seconds) {
        long increment = Math.max(1, rated.getBillingIncrement());
        long units = (seconds + increment - 1) / increment;
        BigDecimal chargedSeconds = BigDecimal.valueOf(units * increment);
        BigDecimal rate = nonNull(rated.getRatePerMinute());
        return rate.multiply(chargedSeconds).divide(SECONDS_PER_MINUTE, SCALE + 6, RoundingMode.HALF_UP);
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
