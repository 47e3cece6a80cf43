package io.jamsession.server.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Rate limiting SPI for the jam session HTTP surface.
 *
 * <p>When a request is rejected the server answers 429 Too Many Requests, with a Retry-After header
 * when the limiter can say how long to wait.
 */
public interface RateLimiter {

    /**
     * Check if a request should be allowed.
     *
     * @param jamId jam addressed by the request, or null for non-jam routes
     * @param clientId client identifier (remote address or forwarded address); may be null
     */
    Result tryAcquire(String jamId, String clientId);

    sealed interface Result permits Result.Allowed, Result.Rejected {

        record Allowed() implements Result {}

        /**
         * @param retryAfter optional duration after which the client may retry
         */
        record Rejected(Optional<Duration> retryAfter) implements Result {
            public Rejected(Duration retryAfter) {
                this(Optional.ofNullable(retryAfter));
            }
        }
    }

    /**
     * Rate limiter that allows every request.
     */
    static RateLimiter permitAll() {
        return (jamId, clientId) -> new Result.Allowed();
    }
}
