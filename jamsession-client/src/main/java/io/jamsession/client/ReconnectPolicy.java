package io.jamsession.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for re-establishing a lost feed connection.
 *
 * @param initialDelay wait before the first reconnect attempt
 * @param multiplier growth factor applied per attempt
 * @param maxDelay upper bound on any single wait
 * @param maxAttempts reconnect attempts before giving up
 */
public record ReconnectPolicy(Duration initialDelay, double multiplier, Duration maxDelay, int maxAttempts) {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    public ReconnectPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must not be negative");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be at least 1");
        if (maxDelay.compareTo(initialDelay) < 0) throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must not be negative");
    }

    /** 1s, 2s, 4s, 8s, 16s, then give up. */
    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Wait before the given reconnect attempt.
     *
     * @param attempt 1-based attempt number
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean shouldRetry(int attempt) {
        return attempt <= maxAttempts;
    }
}
