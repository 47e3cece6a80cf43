package io.jamsession.server.core;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP methods understood by {@link JamSessionHandler}.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE;

    /**
     * @return empty for methods the handler does not serve (they map to 405)
     */
    public static Optional<HttpMethod> parse(String method) {
        if (method == null) return Optional.empty();
        try {
            return Optional.of(valueOf(method.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    boolean isMutation() {
        return this != GET;
    }
}
