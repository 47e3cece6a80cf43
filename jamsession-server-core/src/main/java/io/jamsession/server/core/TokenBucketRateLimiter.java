package io.jamsession.server.core;

import io.jamsession.server.spi.RateLimiter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket rate limiter keyed by client.
 *
 * <p>Suitable for a single server instance. Each client gets a bucket of {@code capacity} tokens refilled
 * continuously at {@code refillPerSecond}; a request takes one token.
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    public static final int DEFAULT_CAPACITY = 60;
    public static final double DEFAULT_REFILL_PER_SECOND = 10.0;

    private final int capacity;
    private final double refillPerSecond;
    private final Clock clock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    /**
     * Creates a rate limiter allowing bursts of 60 requests and 10 requests/second sustained.
     */
    public TokenBucketRateLimiter() {
        this(DEFAULT_CAPACITY, DEFAULT_REFILL_PER_SECOND, Clock.systemUTC());
    }

    public TokenBucketRateLimiter(int capacity, double refillPerSecond, Clock clock) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond must be positive");
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result tryAcquire(String jamId, String clientId) {
        String key = clientId != null ? clientId : "anonymous";
        Instant now = clock.instant();
        return buckets.computeIfAbsent(key, k -> new Bucket(capacity, now)).take(now);
    }

    /** Number of clients currently tracked. */
    public int trackedClients() {
        return buckets.size();
    }

    public void reset() {
        buckets.clear();
    }

    private final class Bucket {
        private double tokens;
        private Instant refilledAt;

        Bucket(double tokens, Instant now) {
            this.tokens = tokens;
            this.refilledAt = now;
        }

        synchronized Result take(Instant now) {
            if (now.isAfter(refilledAt)) {
                double seconds = Duration.between(refilledAt, now).toNanos() / 1_000_000_000.0;
                tokens = Math.min(capacity, tokens + seconds * refillPerSecond);
                refilledAt = now;
            }
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return new Result.Allowed();
            }
            long waitMillis = (long) Math.ceil((1.0 - tokens) / refillPerSecond * 1000);
            return new Result.Rejected(Duration.ofMillis(Math.max(1, waitMillis)));
        }
    }
}
