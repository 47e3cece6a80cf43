package io.jamsession.client;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP request handed to a {@link JamSessionTransport}.
 *
 * @param body request body, or null for none
 * @param timeout per-request timeout, or null for the transport default
 */
public record TransportRequest(
        String method,
        URI url,
        Map<String, ? extends Iterable<String>> headers,
        byte[] body,
        Duration timeout) {}
