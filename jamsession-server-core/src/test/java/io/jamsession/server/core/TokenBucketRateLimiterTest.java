package io.jamsession.server.core;

import io.jamsession.server.spi.RateLimiter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T20:00:00Z"));

    @Test
    void allowsBurstThenRejectsWithRetryAfter() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(3, 1.0, clock);

        for (int i = 0; i < 3; i++) {
            assertThat(limiter.tryAcquire("jam", "10.0.0.1")).isInstanceOf(RateLimiter.Result.Allowed.class);
        }
        RateLimiter.Result rejected = limiter.tryAcquire("jam", "10.0.0.1");

        assertThat(rejected).isInstanceOf(RateLimiter.Result.Rejected.class);
        assertThat(((RateLimiter.Result.Rejected) rejected).retryAfter()).contains(Duration.ofSeconds(1));
    }

    @Test
    void refillsOverTime() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1, 2.0, clock);
        limiter.tryAcquire("jam", "c");
        assertThat(limiter.tryAcquire("jam", "c")).isInstanceOf(RateLimiter.Result.Rejected.class);

        clock.advance(Duration.ofMillis(500));

        assertThat(limiter.tryAcquire("jam", "c")).isInstanceOf(RateLimiter.Result.Allowed.class);
    }

    @Test
    void clientsHaveSeparateBuckets() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1, 1.0, clock);

        assertThat(limiter.tryAcquire("jam", "a")).isInstanceOf(RateLimiter.Result.Allowed.class);
        assertThat(limiter.tryAcquire("jam", "b")).isInstanceOf(RateLimiter.Result.Allowed.class);
        assertThat(limiter.tryAcquire("jam", null)).isInstanceOf(RateLimiter.Result.Allowed.class);
        assertThat(limiter.trackedClients()).isEqualTo(3);

        limiter.reset();
        assertThat(limiter.trackedClients()).isZero();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(0, 1.0, clock)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucketRateLimiter(1, 0, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}
