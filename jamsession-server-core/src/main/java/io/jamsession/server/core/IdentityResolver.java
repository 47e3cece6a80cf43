package io.jamsession.server.core;

import io.jamsession.core.ActorId;
import io.jamsession.core.JamSessionException;
import io.jamsession.server.spi.Attendee;
import io.jamsession.server.spi.Jam;
import io.jamsession.server.spi.JamStore;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps the identifiers a caller presents to the actor that owns its votes in one jam.
 *
 * <p>An attendee id wins over a session token. A session token bound to an attendee of the jam resolves
 * to that attendee, so a browser that registered keeps a single identity whichever id it sends.
 */
public final class IdentityResolver {

    private final JamStore store;
    private final StoreRetrier retrier;

    public IdentityResolver(JamStore store) {
        this(store, StoreRetrier.defaults());
    }

    IdentityResolver(JamStore store, StoreRetrier retrier) {
        this.store = Objects.requireNonNull(store, "store");
        this.retrier = Objects.requireNonNull(retrier, "retrier");
    }

    /**
     * @throws JamSessionException.UnknownJam if the jam does not exist
     * @throws JamSessionException.UnknownAttendee if the attendee id is not an attendee of this jam
     * @throws JamSessionException.InvalidRequest if neither identifier is present
     */
    public ActorId resolve(String jamId, String sessionToken, String attendeeId) {
        requireJam(jamId);
        if (!isBlank(attendeeId)) {
            return ActorId.attendee(requireAttendee(jamId, attendeeId).id());
        }
        if (isBlank(sessionToken)) {
            throw new JamSessionException.InvalidRequest("attendee_id or session_id is required");
        }
        Optional<Attendee> bound = retrier.call("find attendee by session",
                () -> store.findAttendeeBySession(jamId, sessionToken));
        return bound.map(a -> ActorId.attendee(a.id())).orElseGet(() -> ActorId.session(sessionToken));
    }

    public Jam requireJam(String jamId) {
        if (isBlank(jamId)) throw new JamSessionException.UnknownJam(String.valueOf(jamId));
        return retrier.call("find jam", () -> store.findJam(jamId))
                .orElseThrow(() -> new JamSessionException.UnknownJam(jamId));
    }

    /**
     * Performance registration is for registered attendees only; the jam is assumed to exist.
     */
    public Attendee requireAttendee(String jamId, String attendeeId) {
        if (isBlank(attendeeId)) {
            throw new JamSessionException.InvalidRequest("attendee_id is required");
        }
        return retrier.call("find attendee", () -> store.findAttendee(jamId, attendeeId))
                .orElseThrow(() -> new JamSessionException.UnknownAttendee(attendeeId));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
