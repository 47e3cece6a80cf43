package io.jamsession.server.core;

import java.time.Instant;

/**
 * A new performance registration plus the number the attendee now holds in the jam.
 */
public record PerformanceResult(
        String songId,
        String attendeeId,
        String attendeeName,
        String instrument,
        Instant registeredAt,
        int activeCount) {}
