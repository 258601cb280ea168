package com.renewalsync.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter and an upper bound. Used for per-call RPC retries and for the
 * poll loop's delay after consecutive failed iterations.
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
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = Math.max(0L, maxDelayMs);
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then ±jitter, never above maxDelay.
     */
    public long delayMs(int attempt) {
        int shift = Math.min(Math.max(attempt, 0), 20);
        long exponential = baseDelayMs * (1L << shift);
        long capped = Math.min(exponential, maxDelayMs);
        return Math.min(jitter(capped), maxDelayMs);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 500ms base, ±20% jitter, 3 attempts, no ceiling.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }
}
