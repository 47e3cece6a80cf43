package io.jamsession.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * An attendee's registration to perform a song.
 *
 * @param attendeeName display name, joined in by the store for listings
 */
public record PerformanceRegistration(
        String jamId,
        String songId,
        String attendeeId,
        String attendeeName,
        String instrument,
        Instant registeredAt) {

    public PerformanceRegistration {
        Objects.requireNonNull(jamId, "jamId");
        Objects.requireNonNull(songId, "songId");
        Objects.requireNonNull(attendeeId, "attendeeId");
        Objects.requireNonNull(instrument, "instrument");
    }
}
