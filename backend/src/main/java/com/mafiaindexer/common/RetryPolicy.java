package com.mafiaindexer.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter and an upper bound.
 * Shared by RPC retries, storage retries of a transaction unit and the fallback poll loop.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, jitterFactor, maxAttempts, Long.MAX_VALUE);
    }

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.jitterFactor = Math.max(0, jitterFactor);
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = Math.max(0, maxDelayMs);
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(Math.min(baseDelayMs, maxDelayMs));
        }
        int shift = Math.min(attempt, 20);
        long exponential = baseDelayMs > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseDelayMs << shift;
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, ±20% jitter, 5 max attempts, no cap.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 5);
    }
}
