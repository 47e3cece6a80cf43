package io.jamsession.server.spi;

import java.util.Objects;

/**
 * Result of a performance registration attempt.
 */
public final class RegistrationOutcome {

    public enum Status {
        REGISTERED,
        DUPLICATE,
        LIMIT_EXCEEDED
    }

    private final Status status;
    private final PerformanceRegistration registration;
    private final int activeCount;

    public RegistrationOutcome(Status status, PerformanceRegistration registration, int activeCount) {
        this.status = Objects.requireNonNull(status, "status");
        this.registration = registration;
        this.activeCount = activeCount;
    }

    public static RegistrationOutcome registered(PerformanceRegistration registration, int activeCount) {
        return new RegistrationOutcome(Status.REGISTERED, Objects.requireNonNull(registration, "registration"), activeCount);
    }

    public static RegistrationOutcome duplicate(int activeCount) {
        return new RegistrationOutcome(Status.DUPLICATE, null, activeCount);
    }

    public static RegistrationOutcome limitExceeded(int activeCount) {
        return new RegistrationOutcome(Status.LIMIT_EXCEEDED, null, activeCount);
    }

    public Status status() {
        return status;
    }

    /** The new registration; null unless {@link Status#REGISTERED}. */
    public PerformanceRegistration registration() {
        return registration;
    }

    /** Registrations the attendee holds in the jam after the attempt. */
    public int activeCount() {
        return activeCount;
    }
}
