package com.infomedia.abacox.callbilling.component.eventsocket;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff for the event socket client.
 * <p>
 * Transport and protocol failures are retried forever with a delay of
 * {@code initialDelay * 2^(n-1)} capped at {@code maxDelay}, spread by a symmetric jitter.
 * Authentication rejections are counted on their own: once {@code maxAuthFailures} happen
 * without a successful login in between, {@link #shouldRetryAfterAuthFailure()} turns false.
 * Not thread safe; owned by the client loop.
 */
public class ReconnectPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final int maxAuthFailures;
    private final DoubleSupplier random;

    private int consecutiveFailures;
    private int consecutiveAuthFailures;

    public ReconnectPolicy(Duration initialDelay, Duration maxDelay, double jitter, int maxAuthFailures) {
        this(initialDelay, maxDelay, jitter, maxAuthFailures, () -> ThreadLocalRandom.current().nextDouble());
    }

    ReconnectPolicy(Duration initialDelay, Duration maxDelay, double jitter, int maxAuthFailures, DoubleSupplier random) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.maxAuthFailures = Math.max(1, maxAuthFailures);
        this.random = random;
    }

    /**
     * Registers a failed attempt and returns how long to wait before the next one.
     */
    public Duration nextDelay() {
        consecutiveFailures++;
        long base = initialDelay.toMillis();
        int shift = Math.min(consecutiveFailures - 1, 30);
        long exponential = base << shift;
        if (exponential <= 0 || exponential > maxDelay.toMillis()) {
            exponential = maxDelay.toMillis();
        }
        double factor = 1 + jitter * (2 * random.getAsDouble() - 1);
        return Duration.ofMillis(Math.max(0, Math.round(exponential * factor)));
    }

    public void recordAuthFailure() {
        consecutiveAuthFailures++;
    }

    public boolean shouldRetryAfterAuthFailure() {
        return consecutiveAuthFailures < maxAuthFailures;
    }

    /**
     * Called once a session is authenticated and subscribed.
     */
    public void reset() {
        consecutiveFailures = 0;
        consecutiveAuthFailures = 0;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int getConsecutiveAuthFailures() {
        return consecutiveAuthFailures;
    }
}
