package io.otto4j.outbound;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry budget and exponential backoff for outbound delivery.
 *
 * <p>{@code delay(attempt) = min(baseDelay * 2^(attempt - 1), maxDelay)}; attempt 1 yields exactly
 * {@code baseDelay}. No jitter is applied so retry timing is reproducible.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be a positive duration");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    public long calculateRetryDelayMs(int attempt) {
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        long delay = base;
        // doubling stops at the cap, so this never overflows
        for (int i = 1; i < attempt && delay < max; i++) {
            delay = delay * 2;
        }
        return Math.min(delay, max);
    }

    public Duration delay(int attempt) {
        return Duration.ofMillis(calculateRetryDelayMs(attempt));
    }

    /**
     * @param nextAttempt the attempt count after the failed attempt is recorded
     */
    public boolean hasAttemptsLeft(int nextAttempt) {
        return nextAttempt < maxAttempts;
    }
}
