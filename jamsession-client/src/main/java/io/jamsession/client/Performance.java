package io.jamsession.client;

import java.time.Instant;

/**
 * A performance registration.
 *
 * @param activeCount registrations the attendee holds in the jam; only set on the response to a registration
 */
public record Performance(
        String songId,
        String attendeeId,
        String attendeeName,
        String instrument,
        Instant registeredAt,
        int activeCount) {}
