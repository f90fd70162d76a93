package de.mirkosertic.docmirror.util;

import java.util.function.IntPredicate;

/**
 * Bounded exponential backoff.
 * <p>
 * An operation is attempted at most {@code maxRetries + 1} times. The delay before
 * retry number {@code attempt + 1} is {@code initialBackoffMs * multiplier^attempt}.
 */
public record RetryPolicy(
        /** Number of retries after the first attempt. */
        int maxRetries,
        /** Delay before the first retry. */
        long initialBackoffMs,
        /** Growth factor applied per attempt. */
        double multiplier,
        /** Decides whether an HTTP-style status is worth another attempt. */
        IntPredicate retryableStatus
) {

    /** 429 (rate limited) and every 5xx status. */
    public static final IntPredicate RATE_LIMIT_OR_SERVER_ERROR = status -> status == 429 || status >= 500;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (initialBackoffMs < 0) {
            throw new IllegalArgumentException("initialBackoffMs must not be negative: " + initialBackoffMs);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
    }

    public static RetryPolicy exponential(final int maxRetries, final long initialBackoffMs) {
        return new RetryPolicy(maxRetries, initialBackoffMs, 2.0, RATE_LIMIT_OR_SERVER_ERROR);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public long delayForAttempt(final int attempt) {
        return (long) (initialBackoffMs * Math.pow(multiplier, attempt));
    }

    public boolean isRetryable(final int status) {
        return retryableStatus.test(status);
    }

    public boolean hasAttemptsLeft(final int attempt) {
        return attempt < maxRetries;
    }
}
