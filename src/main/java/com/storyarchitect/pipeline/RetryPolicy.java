package com.storyarchitect.pipeline;

import com.storyarchitect.providers.GenerationException;
import com.storyarchitect.providers.RateLimitException;

/**
 * Bounded exponential backoff for retryable provider failures.
 * {@code maxAttempts} counts the first call.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_INITIAL_DELAY_MS = 500;
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final long DEFAULT_MAX_DELAY_MS = 8000;

    private final int maxAttempts;
    private final long initialDelayMs;
    private final double multiplier;
    private final long maxDelayMs;

    public RetryPolicy(int maxAttempts, long initialDelayMs, double multiplier, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialDelayMs < 0 || maxDelayMs < 0 || multiplier < 1.0) {
            throw new IllegalArgumentException("Invalid backoff: initial=" + initialDelayMs
                + " multiplier=" + multiplier + " max=" + maxDelayMs);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY_MS, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY_MS);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, initialDelayMs, multiplier, maxDelayMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Wait after the given failed attempt (1-based): 500, 1000, 2000 ... ms,
     * capped at {@code maxDelayMs}.
     */
    public long delayForAttempt(int failedAttempt) {
        double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return (long) Math.min(maxDelayMs, delay);
    }

    /**
     * Like {@link #delayForAttempt(int)} but waits at least as long as a
     * rate-limit response asked, still within {@code maxDelayMs}.
     */
    public long delayFor(GenerationException failure, int failedAttempt) {
        long delay = delayForAttempt(failedAttempt);
        if (failure instanceof RateLimitException) {
            Long retryAfter = ((RateLimitException) failure).getRetryAfterMs();
            if (retryAfter != null && retryAfter > delay) {
                delay = Math.min(maxDelayMs, retryAfter);
            }
        }
        return delay;
    }

    public boolean shouldRetry(GenerationException failure, int attempt) {
        return failure.isRetryable() && attempt < maxAttempts;
    }
}
