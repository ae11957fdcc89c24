package com.delta.opportunities.pipeline.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounded exponential backoff shared by every component that retries external calls.
 * Attempt numbers are 1-based: attempt 1 is the first call.
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    double multiplier,
    Duration maxDelay
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            maxDelay = baseDelay;
        }
    }

    public boolean canRetryAfter(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    /**
     * Delay before the next attempt once {@code failedAttempts} calls have failed.
     */
    public Duration delayAfter(int failedAttempts) {
        int exponent = Math.max(0, failedAttempts - 1);
        double factor = Math.pow(multiplier, exponent);
        double millis = baseDelay.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public Instant nextAttemptAt(Instant failedAt, int failedAttempts) {
        return failedAt.plus(delayAfter(failedAttempts));
    }
}
