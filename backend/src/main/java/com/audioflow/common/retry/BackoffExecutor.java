package com.audioflow.common.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs an operation under a {@link RetryPolicy} with deterministic exponential backoff.
 * Holds no per-invocation state, so a single instance is shared by all callers.
 */
public class BackoffExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackoffExecutor.class);

    private final Sleeper sleeper;

    public BackoffExecutor() {
        this(Sleeper.threadSleep());
    }

    public BackoffExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T execute(Supplier<T> operation, RetryPolicy policy) {
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                if (attempt >= policy.maxAttempts()) {
                    throw exception;
                }

                Duration delay = policy.delayAfter(attempt);
                log.warn("Retry attempt {}/{} after {}ms: {}",
                        attempt, policy.maxAttempts(), delay.toMillis(), exception.getMessage());
                if (policy.onRetry() != null) {
                    policy.onRetry().accept(attempt, exception);
                }

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    exception.addSuppressed(interrupted);
                    throw exception;
                }
                attempt++;
            }
        }
    }

    @FunctionalInterface
    public interface Sleeper {

        void sleep(Duration duration) throws InterruptedException;

        static Sleeper threadSleep() {
            return duration -> Thread.sleep(duration.toMillis());
        }
    }
}
