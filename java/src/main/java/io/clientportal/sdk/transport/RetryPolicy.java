package io.clientportal.sdk.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff applied to 5xx responses and network failures.
 *
 * @param maxRetries        additional attempts after the first one; total attempts never exceed {@code maxRetries + 1}.
 * @param baseDelay         delay before the first retry.
 * @param backoffMultiplier growth factor applied per attempt; must be at least 1.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, double backoffMultiplier) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1), 2.0);

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("MaxRetries cannot be negative");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("RetryBaseDelay cannot be negative");
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("RetryBackoffMultiplier must be at least 1");
        }
    }

    /**
     * Delay to wait after the failed attempt with index {@code attempt} (starting at 0):
     * {@code baseDelay * backoffMultiplier^attempt}.
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt cannot be negative");
        }
        double millis = baseDelay.toMillis() * Math.pow(backoffMultiplier, attempt);
        return Duration.ofMillis(Math.round(millis));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
