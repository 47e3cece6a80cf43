package io.jamsession.server.spi;

import io.jamsession.core.ActorId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence abstraction for jam sessions.
 *
 * <p>This SPI is blocking. It is the single source of truth: vote counts are always aggregated from
 * vote rows, never kept as a separate counter. Implementations must enforce at most one vote per
 * (jam, song, actor), at most one registration per (jam, song, attendee), at most one attendee per
 * (jam, name) and per (jam, session token).
 *
 * <p>A {@link StoreConflictException} tells the caller the operation changed nothing and may be retried.
 */
public interface JamStore {

    // Jams

    /**
     * @throws StoreConflictException if another jam already uses the slug
     */
    Jam createJam(String name, String slug, Instant now) throws StoreException;

    Optional<Jam> findJam(String jamId) throws StoreException;

    Optional<Jam> findJamBySlug(String slug) throws StoreException;

    /**
     * @return the updated jam, or empty if it does not exist
     */
    Optional<Jam> updateJamStatus(String jamId, JamStatus status) throws StoreException;

    // Catalog

    Song createSong(String title, String artist) throws StoreException;

    Optional<Song> findSong(String songId) throws StoreException;

    // Queue

    /**
     * Queue a catalog song in a jam.
     */
    AddSongOutcome addSong(String jamId, String songId, Instant now) throws StoreException;

    /**
     * Queued songs of a jam with current vote counts, in insertion order.
     */
    List<JamSong> jamSongs(String jamId) throws StoreException;

    Optional<JamSong> findJamSong(String jamId, String songId) throws StoreException;

    /**
     * Flag a queued song as played, make it the jam's current song and bump the catalog play count.
     *
     * @return false if the song is not queued in the jam
     */
    boolean markPlayed(String jamId, String songId, Instant now) throws StoreException;

    // Attendees

    /**
     * Register a name in a jam, or re-bind an existing name to the given session token.
     * A token bound to another attendee of the same jam moves to this one.
     */
    AttendeeOutcome upsertAttendee(String jamId, String name, String sessionToken, Instant now) throws StoreException;

    Optional<Attendee> findAttendee(String jamId, String attendeeId) throws StoreException;

    Optional<Attendee> findAttendeeBySession(String jamId, String sessionToken) throws StoreException;

    List<Attendee> attendees(String jamId) throws StoreException;

    // Votes

    /**
     * Atomically delete the vote row if present, else insert it.
     */
    ToggleOutcome toggleVote(String jamId, String songId, ActorId actor, Instant now) throws StoreException;

    boolean hasVoted(String jamId, String songId, ActorId actor) throws StoreException;

    int voteCount(String jamId, String songId) throws StoreException;

    List<Vote> votesBy(String jamId, ActorId actor) throws StoreException;

    /**
     * Re-key every vote of {@code from} in the jam to {@code to}. Where {@code to} already voted for the
     * same song, the {@code from} row is deleted instead.
     *
     * @return number of votes moved to {@code to}
     */
    int reassignVotes(String jamId, ActorId from, ActorId to) throws StoreException;

    // Performance registrations

    /**
     * Insert a registration unless the attendee is already registered for the song or already holds
     * {@code limit} registrations in the jam. The limit check and the insert are atomic.
     */
    RegistrationOutcome registerPerformance(String jamId, String songId, String attendeeId, String instrument,
                                            int limit, Instant now) throws StoreException;

    /**
     * @return false if no registration existed
     */
    boolean unregisterPerformance(String jamId, String songId, String attendeeId) throws StoreException;

    /**
     * Registrations in a jam, optionally restricted to one song ({@code songId} may be null).
     */
    List<PerformanceRegistration> performers(String jamId, String songId) throws StoreException;

    List<PerformanceRegistration> registrationsOf(String jamId, String attendeeId) throws StoreException;
}
