package com.id.fieldbridge.modules.executor;

import java.time.Duration;

/**
 * Bounded exponential backoff: the delay doubles after every failed attempt, capped at the max.
 */
public record RetryBackoff(int maxAttempts, Duration initial, Duration max) {

    public RetryBackoff {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Invalid backoff bounds %s..%s".formatted(initial, max));
        }
    }

    /**
     * @param failedAttempts attempts made so far, starting at 1
     */
    public Duration delayAfter(int failedAttempts) {
        long delay = initial.toMillis();
        for (int i = 1; i < failedAttempts && delay < max.toMillis(); i++) {
            delay *= 2;
        }
        return Duration.ofMillis(Math.min(delay, max.toMillis()));
    }

    public boolean hasAttemptsLeft(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }
}
