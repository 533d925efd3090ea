package com.dynop.routing.hybrid.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry plan with exponential backoff.
 *
 * <p>Attempts are numbered from 1. The first attempt runs immediately; attempt {@code n > 1} waits
 * {@code base * 2^(n-2)}, so a one-second base yields waits of 1s, 2s, 4s, ...
 */
public final class RetrySchedule {

    private static final int MAX_SHIFT = 30;

    private final int maxRetries;
    private final Duration baseDelay;

    /**
     * @param maxRetries attempts allowed after the first one
     * @param baseDelay  wait before the first retry
     */
    public RetrySchedule(int maxRetries, Duration baseDelay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
    }

    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    /**
     * @param attempt number of the attempt that just failed
     * @return true if another attempt is allowed
     */
    public boolean hasAttemptAfter(int attempt) {
        return attempt < getMaxAttempts();
    }

    /**
     * @param attempt number of the attempt about to start
     * @return wait before that attempt
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        int shift = Math.min(attempt - 2, MAX_SHIFT);
        return baseDelay.multipliedBy(1L << shift);
    }
}
