package io.jamsession.server.core;

import io.jamsession.core.JamSessionException;
import io.jamsession.server.spi.StoreConflictException;
import io.jamsession.server.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs store calls with a bounded number of retries on {@link StoreConflictException}.
 *
 * <p>Attempt {@code n} waits {@code n * backoff} before running again. Exhausted retries and any other
 * {@link StoreException} surface as {@link JamSessionException.StoreUnavailable}.
 */
final class StoreRetrier {
    private static final Logger logger = LoggerFactory.getLogger(StoreRetrier.class);

    static final int DEFAULT_MAX_RETRIES = 3;
    static final Duration DEFAULT_BACKOFF = Duration.ofMillis(10);

    private final int maxRetries;
    private final Duration backoff;

    StoreRetrier(int maxRetries, Duration backoff) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    static StoreRetrier defaults() {
        return new StoreRetrier(DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF);
    }

    int maxRetries() {
        return maxRetries;
    }

    <T> T call(String operation, StoreCall<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.call();
            } catch (StoreConflictException conflict) {
                if (attempt >= maxRetries) {
                    logger.warn("{} still conflicting after {} retries", operation, maxRetries, conflict);
                    throw new JamSessionException.StoreUnavailable(operation + " failed after retries", conflict);
                }
                attempt++;
                logger.debug("{} conflicted, retry {}/{}", operation, attempt, maxRetries);
                pause(attempt);
            } catch (StoreException e) {
                logger.warn("{} failed", operation, e);
                throw new JamSessionException.StoreUnavailable(operation + " failed", e);
            }
        }
    }

    private void pause(int attempt) {
        long millis = backoff.toMillis() * attempt;
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JamSessionException.StoreUnavailable("interrupted while retrying", e);
        }
    }
}
