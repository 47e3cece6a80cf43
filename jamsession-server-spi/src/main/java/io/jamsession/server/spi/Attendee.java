package io.jamsession.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * A registered participant of one jam.
 *
 * @param sessionToken browser session token currently bound to the attendee, or null
 */
public record Attendee(String id, String jamId, String name, String sessionToken, Instant registeredAt) {

    public Attendee {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(jamId, "jamId");
        Objects.requireNonNull(name, "name");
    }
}
