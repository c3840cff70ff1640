package com.audioflow.common.retry;

import java.time.Duration;
import java.util.function.BiConsumer;

public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        BiConsumer<Integer, RuntimeException> onRetry
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be zero or positive");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
    }

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        this(maxAttempts, initialDelay, maxDelay, null);
    }

    public RetryPolicy withObserver(BiConsumer<Integer, RuntimeException> observer) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, observer);
    }

    /**
     * Delay to wait after the given failed attempt (1-based): {@code min(initialDelay * 2^(attempt-1), maxDelay)}.
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        long initialMs = initialDelay.toMillis();
        long maxMs = maxDelay.toMillis();
        int shift = attempt - 1;
        if (initialMs == 0) {
            return Duration.ZERO;
        }
        if (shift >= Long.numberOfLeadingZeros(initialMs) - 1) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(initialMs << shift, maxMs));
    }
}
