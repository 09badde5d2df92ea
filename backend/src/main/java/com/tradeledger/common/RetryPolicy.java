package com.tradeledger.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for exchange calls. Delays are capped at {@code maxDelayMs}.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the retry that follows the given zero-based failed attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor <= 0 || value == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Total attempts including the first call. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 500ms base, 10s cap, ±20% jitter, 4 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 10_000L, 0.2, 4);
    }

    /** Single attempt, no delay. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0L, 0L, 0.0, 1);
    }
}
