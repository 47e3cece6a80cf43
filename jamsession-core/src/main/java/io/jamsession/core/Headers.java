package io.jamsession.core;

import java.util.Map;
import java.util.Optional;

/**
 * Header lookups shared by the server adapters and the client.
 */
public final class Headers {
    private Headers() {}

    /**
     * First non-null value of a header, matching the name case-insensitively.
     */
    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (!name.equalsIgnoreCase(e.getKey()) || e.getValue() == null) continue;
            for (String v : e.getValue()) {
                if (v != null) return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Originating client of a proxied request: the left-most entry of an {@code X-Forwarded-For} value.
     *
     * @return empty when the value is null or blank
     */
    public static Optional<String> forwardedClient(String forwardedFor) {
        if (forwardedFor == null) return Optional.empty();
        int comma = forwardedFor.indexOf(',');
        String first = (comma >= 0 ? forwardedFor.substring(0, comma) : forwardedFor).trim();
        return first.isEmpty() ? Optional.empty() : Optional.of(first);
    }
}
