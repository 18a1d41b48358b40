package io.forecast4j.internal;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff.
 * attempt starts from 1 (first failure).
 * e.g. initial 2s, max 30s: 2s, 4s, 8s, 16s, 30s, 30s...
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Same delay before every retry.
     */
    public static RetryPolicy fixed(int maxAttempts, Duration backoff) {
        return new RetryPolicy(maxAttempts, backoff, backoff);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean canRetry(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    public Duration backoff(int failedAttempts) {
        int exp = Math.max(0, failedAttempts - 1);
        exp = Math.min(exp, 20); // avoid overflow
        long ms = Math.min(initialBackoff.toMillis() * (1L << exp), maxBackoff.toMillis());
        return Duration.ofMillis(ms);
    }

    /**
     * Sleep for the backoff of the given attempt.
     *
     * @return false if the thread was interrupted (the interrupt flag is restored)
     */
    public boolean pause(int failedAttempts) {
        long ms = backoff(failedAttempts).toMillis();
        if (ms <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
