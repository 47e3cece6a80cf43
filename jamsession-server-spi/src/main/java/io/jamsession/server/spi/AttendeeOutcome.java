package io.jamsession.server.spi;

import java.util.Objects;

/**
 * Result of registering an attendee name in a jam.
 */
public final class AttendeeOutcome {

    public enum Status {
        CREATED,
        UPDATED      // existing name re-bound to the caller's session
    }

    private final Status status;
    private final Attendee attendee;

    public AttendeeOutcome(Status status, Attendee attendee) {
        this.status = Objects.requireNonNull(status, "status");
        this.attendee = Objects.requireNonNull(attendee, "attendee");
    }

    public Status status() {
        return status;
    }

    public Attendee attendee() {
        return attendee;
    }
}
