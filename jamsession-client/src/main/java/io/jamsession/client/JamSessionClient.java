package io.jamsession.client;

import java.io.IOException;
import java.util.List;

/**
 * Client for the jam session HTTP API.
 *
 * <p>Every call carries this client's session id, so anonymous votes are scoped to it; pass the attendee id
 * returned by {@link #registerAttendee(String, String)} once registered. Error responses are raised as
 * {@link JamSessionClientException}.
 */
public interface JamSessionClient {

    static JamSessionClientBuilder builder() {
        return new JamSessionClientBuilder();
    }

    /** Opaque session token sent with every request. */
    String sessionId();

    /**
     * Toggles this client's vote for a song.
     *
     * @param attendeeId the registered attendee, or null to vote anonymously
     */
    VoteResult toggleVote(String jamId, String songId, String attendeeId) throws IOException, InterruptedException;

    VoteStatus voteStatus(String jamId, String songId, String attendeeId) throws IOException, InterruptedException;

    /** Songs this client (or attendee) currently votes for. */
    List<String> votedSongIds(String jamId, String attendeeId) throws IOException, InterruptedException;

    /**
     * Registers an attendee to perform a song.
     *
     * @param instrument instrument to play, or null for the server default
     */
    Performance registerPerformance(String jamId, String songId, String attendeeId, String instrument)
            throws IOException, InterruptedException;

    /**
     * Withdraws a performance registration.
     *
     * @return registrations the attendee still holds in the jam
     */
    int unregisterPerformance(String jamId, String songId, String attendeeId) throws IOException, InterruptedException;

    /**
     * Lists performers of a jam.
     *
     * @param songId restricts the list to one song, or null for every song
     */
    List<Performance> performers(String jamId, String songId) throws IOException, InterruptedException;

    /**
     * Adds a catalog song to a jam's queue.
     *
     * @return the re-ranked queue
     */
    List<QueueEntry> addSong(String jamId, String songId) throws IOException, InterruptedException;

    QueueState queue(String jamId) throws IOException, InterruptedException;

    /**
     * Resolves a shareable slug to its jam.
     *
     * @throws JamSessionClientException with status 404 if no jam uses the slug
     */
    JamInfo jamBySlug(String slug) throws IOException, InterruptedException;

    void markPlayed(String jamId, String songId) throws IOException, InterruptedException;

    AttendeeRegistration registerAttendee(String jamId, String name) throws IOException, InterruptedException;

    List<Attendee> attendees(String jamId) throws IOException, InterruptedException;

    /**
     * Changes a jam's status.
     *
     * @param status one of {@code waiting}, {@code playing}, {@code paused}, {@code ended}
     * @return the status now in effect
     */
    String updateStatus(String jamId, String status) throws IOException, InterruptedException;
}
