package io.jamsession.client;

import java.time.Duration;
import java.util.Optional;

/**
 * Error response from the jam session API.
 *
 * <p>{@link #code()} is the server's machine-readable {@code error} member (for example
 * {@code performance_limit_exceeded}); {@link #getMessage()} is the human readable message, suitable for
 * showing to the user as is.
 */
public class JamSessionClientException extends RuntimeException {

    private final int status;
    private final String code;
    private final Duration retryAfter;

    public JamSessionClientException(int status, String code, String message) {
        this(status, code, message, null);
    }

    public JamSessionClientException(int status, String code, String message, Duration retryAfter) {
        super(message);
        this.status = status;
        this.code = code;
        this.retryAfter = retryAfter;
    }

    public int status() {
        return status;
    }

    public String code() {
        return code;
    }

    /** Server-suggested wait, present on 429 and 503 responses that carry {@code Retry-After}. */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isClientError() {
        return status >= 400 && status < 500;
    }
}
