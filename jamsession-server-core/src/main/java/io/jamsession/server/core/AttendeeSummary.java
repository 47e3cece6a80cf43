package io.jamsession.server.core;

import io.jamsession.server.spi.Attendee;

import java.time.Instant;

/**
 * Public view of an attendee; the session token is never exposed.
 */
public record AttendeeSummary(String attendeeId, String name, Instant registeredAt) {

    static AttendeeSummary of(Attendee attendee) {
        return new AttendeeSummary(attendee.id(), attendee.name(), attendee.registeredAt());
    }
}
