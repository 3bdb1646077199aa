package com.slotmonitor.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter, capped at {@code maxDelayMs}.
 * Attempt numbers are zero-based; {@link #delayMs(int)} gives the pause before the next attempt.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("delays must satisfy 0 <= baseDelayMs <= maxDelayMs");
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * baseDelay * 2^attempt, capped, then jittered by ±jitterFactor.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        long capped = Math.min(exponential, maxDelayMs);
        if (jitterFactor == 0) {
            return capped;
        }
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (capped * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Single attempt, no waiting. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, 0, 0, 1);
    }
}
