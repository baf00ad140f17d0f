package com.flagship.credit_ledger.support;

import lombok.Value;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * {@code maxAttempts} counts every attempt including the first; zero means unbounded.
 * The delay after attempt n is {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}.
 */
@Value
public class RetryPolicy {
    int maxAttempts;
    Duration initialBackoff;
    Duration maxBackoff;

    public static RetryPolicy of(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("Backoff must satisfy 0 <= initial <= max");
        }
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs));
    }

    public static RetryPolicy unbounded(long initialBackoffMs, long maxBackoffMs) {
        return of(0, initialBackoffMs, maxBackoffMs);
    }

    public boolean isUnbounded() {
        return maxAttempts == 0;
    }

    /**
     * Whether another attempt may follow once {@code attemptsMade} attempts have failed.
     */
    public boolean allowsRetryAfter(int attemptsMade) {
        return isUnbounded() || attemptsMade < maxAttempts;
    }

    public Duration backoffAfter(int attemptsMade) {
        if (attemptsMade < 1) {
            return Duration.ZERO;
        }
        long initial = initialBackoff.toMillis();
        int shift = Math.min(attemptsMade - 1, 30);
        long delay = initial << shift;
        if (delay < initial || delay > maxBackoff.toMillis()) {
            delay = maxBackoff.toMillis();
        }
        return Duration.ofMillis(delay);
    }
}
