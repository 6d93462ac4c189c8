package edu.brandeis.cosi103a.league.broadcast;

import java.time.Duration;

/**
 * Bounded retry for one delivery: {@code maxRetries + 1} attempts, each limited by
 * {@code requestTimeout}, waiting {@code backoffUnit * (attempt + 1)} between attempts.
 */
public record RetryPolicy(int maxRetries, Duration requestTimeout, Duration backoffUnit) {

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofMillis(500);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (backoffUnit.isNegative()) {
            throw new IllegalArgumentException("backoffUnit must be non-negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_REQUEST_TIMEOUT, DEFAULT_BACKOFF_UNIT);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Wait before the attempt following {@code attemptIndex} (zero-based).
     */
    public Duration backoffAfter(int attemptIndex) {
        return backoffUnit.multipliedBy(attemptIndex + 1L);
    }
}
