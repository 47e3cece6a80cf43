package io.jamsession.server.core;

import io.jamsession.core.Headers;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Request handed to {@link JamSessionHandler} by a framework adapter.
 *
 * @param uri request URI relative to the servlet context (or server root)
 * @param body request body, or null when the adapter has none
 */
public record ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {

    public ServerRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : headers;
    }

    /** Still percent-encoded, so ids containing {@code /} survive routing. */
    public String rawPath() {
        return uri.getRawPath();
    }

    /** Decoded query parameters; the first occurrence of a name wins. */
    public Map<String, String> query() {
        return QueryString.parse(uri);
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    /** Mutations read fields from the JSON body; reads use the query string only. */
    boolean carriesFields() {
        return method.isMutation() && body != null;
    }
}
