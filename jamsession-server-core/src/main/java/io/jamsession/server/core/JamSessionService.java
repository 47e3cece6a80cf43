package io.jamsession.server.core;

import io.jamsession.core.ActorId;
import io.jamsession.core.JamEvent;
import io.jamsession.core.JamEventType;
import io.jamsession.core.JamSessionException;
import io.jamsession.core.Protocol;
import io.jamsession.server.spi.AddSongOutcome;
import io.jamsession.server.spi.Attendee;
import io.jamsession.server.spi.AttendeeOutcome;
import io.jamsession.server.spi.Jam;
import io.jamsession.server.spi.JamSong;
import io.jamsession.server.spi.JamStatus;
import io.jamsession.server.spi.JamStore;
import io.jamsession.server.spi.PerformanceRegistration;
import io.jamsession.server.spi.RegistrationOutcome;
import io.jamsession.server.spi.Song;
import io.jamsession.server.spi.ToggleOutcome;
import io.jamsession.server.spi.Vote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Jam session mutations and queries.
 *
 * <p>Every mutation resolves the actor, validates the jam and song, applies the change to the store,
 * re-ranks the queue from fresh facts, publishes an event to the jam's live connections and returns the
 * authoritative state to the caller. The caller's response and the broadcast are computed from the same
 * store state, so the acting client and everybody else converge.
 */
public final class JamSessionService {
    private static final Logger logger = LoggerFactory.getLogger(JamSessionService.class);

    private final VoteRegistrationStore votes;
    private final IdentityResolver identity;
    private final RankingEngine ranking;
    private final BroadcastHub hub;

    public JamSessionService(VoteRegistrationStore votes, BroadcastHub hub) {
        this(votes, hub, new RankingEngine());
    }

    public JamSessionService(VoteRegistrationStore votes, BroadcastHub hub, RankingEngine ranking) {
        this.votes = Objects.requireNonNull(votes, "votes");
        this.hub = Objects.requireNonNull(hub, "hub");
        this.ranking = Objects.requireNonNull(ranking, "ranking");
        this.identity = new IdentityResolver(votes.jamStore(), votes.retrier());
    }

    public IdentityResolver identity() {
        return identity;
    }

    public VoteRegistrationStore votes() {
        return votes;
    }

    public BroadcastHub hub() {
        return hub;
    }

    // Votes

    public VoteResult toggleVote(String jamId, String songId, String sessionToken, String attendeeId) {
        ActorId actor = identity.resolve(jamId, sessionToken, attendeeId);
        requireQueued(jamId, songId);

        ToggleOutcome out = votes.toggleVote(jamId, songId, actor);
        List<RankedSong> queue = rankedQueue(jamId);

        hub.publish(JamEvent.builder(jamId, JamEventType.VOTE_UPDATE)
                .put(Protocol.E_SONG_ID, songId)
                .put(Protocol.E_VOTED, out.voted())
                .put(Protocol.E_VOTE_COUNT, out.voteCount())
                .put(Protocol.E_ATTENDEE_ID, actor.isAttendee() ? actor.value() : null)
                .build());
        return new VoteResult(songId, out.voted(), out.voteCount(), queue);
    }

    public VoteStatus voteStatus(String jamId, String songId, String sessionToken, String attendeeId) {
        ActorId actor = identity.resolve(jamId, sessionToken, attendeeId);
        requireQueued(jamId, songId);
        return new VoteStatus(songId, votes.hasVoted(jamId, songId, actor), votes.voteCount(jamId, songId));
    }

    /**
     * Songs the caller has voted for in the jam.
     */
    public List<String> votedSongIds(String jamId, String sessionToken, String attendeeId) {
        ActorId actor = identity.resolve(jamId, sessionToken, attendeeId);
        List<String> out = new ArrayList<>();
        for (Vote v : votes.votesBy(jamId, actor)) {
            out.add(v.songId());
        }
        return out;
    }

    // Performances

    public PerformanceResult registerPerformance(String jamId, String songId, String attendeeId, String instrument) {
        identity.requireJam(jamId);
        Attendee attendee = identity.requireAttendee(jamId, attendeeId);
        requireQueued(jamId, songId);

        RegistrationOutcome out = votes.registerPerformance(jamId, songId, attendee.id(), instrument);
        PerformanceRegistration reg = out.registration();

        hub.publish(JamEvent.builder(jamId, JamEventType.PERFORMANCE_UPDATE)
                .put(Protocol.E_ACTION, Protocol.ACTION_REGISTERED)
                .put(Protocol.E_SONG_ID, songId)
                .put(Protocol.E_ATTENDEE_ID, attendee.id())
                .put(Protocol.E_ATTENDEE_NAME, attendee.name())
                .put(Protocol.E_INSTRUMENT, reg.instrument())
                .build());
        return new PerformanceResult(songId, attendee.id(), attendee.name(), reg.instrument(), reg.registeredAt(),
                out.activeCount());
    }

    public UnregisterResult unregisterPerformance(String jamId, String songId, String attendeeId) {
        identity.requireJam(jamId);
        Attendee attendee = identity.requireAttendee(jamId, attendeeId);
        requireSong(songId);

        int remaining = votes.unregisterPerformance(jamId, songId, attendee.id());

        hub.publish(JamEvent.builder(jamId, JamEventType.PERFORMANCE_UPDATE)
                .put(Protocol.E_ACTION, Protocol.ACTION_UNREGISTERED)
                .put(Protocol.E_SONG_ID, songId)
                .put(Protocol.E_ATTENDEE_ID, attendee.id())
                .put(Protocol.E_ATTENDEE_NAME, attendee.name())
                .build());
        return new UnregisterResult(songId, attendee.id(), remaining);
    }

    /**
     * @param songId null lists the whole jam
     */
    public List<PerformanceRegistration> performers(String jamId, String songId) {
        identity.requireJam(jamId);
        return votes.performers(jamId, songId == null || songId.isBlank() ? null : songId);
    }

    // Queue

    public AddSongResult addSong(String jamId, String songId) {
        identity.requireJam(jamId);
        Song song = requireSong(songId);

        AddSongOutcome out = votes.call("add song",
                () -> votes.jamStore().addSong(jamId, songId, votes.clock().instant()));
        if (out.status() == AddSongOutcome.Status.ALREADY_PRESENT) {
            throw new JamSessionException.SongAlreadyInJam(songId);
        }
        List<RankedSong> queue = rankedQueue(jamId);
        logger.debug("Song {} added to jam {}", songId, jamId);

        hub.publish(JamEvent.builder(jamId, JamEventType.SONG_ADDED)
                .put(Protocol.E_SONG_ID, songId)
                .put(Protocol.E_TITLE, song.title())
                .put(Protocol.E_ARTIST, song.artist())
                .build());
        return new AddSongResult(songId, queue);
    }

    /**
     * @throws JamSessionException.UnknownJam if no jam uses the slug
     */
    public JamSummary jamBySlug(String slug) {
        if (slug == null || slug.isBlank()) {
            throw new JamSessionException.UnknownJam(String.valueOf(slug));
        }
        Jam jam = votes.call("find jam by slug", () -> votes.jamStore().findJamBySlug(slug))
                .orElseThrow(() -> new JamSessionException.UnknownJam(slug));
        return JamSummary.of(jam);
    }

    public QueueSnapshot queue(String jamId) {
        Jam jam = identity.requireJam(jamId);
        return new QueueSnapshot(jam.id(), jam.status().wireName(), jam.currentSongId(), rankedQueue(jamId));
    }

    public PlayResult markPlayed(String jamId, String songId) {
        identity.requireJam(jamId);
        requireQueued(jamId, songId);
        boolean updated = votes.call("mark played",
                () -> votes.jamStore().markPlayed(jamId, songId, votes.clock().instant()));
        if (!updated) {
            throw new JamSessionException.SongNotInJam(songId);
        }
        hub.publish(JamEvent.builder(jamId, JamEventType.SONG_PLAYED)
                .put(Protocol.E_SONG_ID, songId)
                .build());
        return new PlayResult(songId, true);
    }

    public JamStatusResult updateStatus(String jamId, JamStatus status) {
        Objects.requireNonNull(status, "status");
        identity.requireJam(jamId);
        Jam jam = votes.call("update jam status", () -> votes.jamStore().updateJamStatus(jamId, status))
                .orElseThrow(() -> new JamSessionException.UnknownJam(jamId));
        logger.info("Jam {} is now {}", jamId, jam.status().wireName());

        hub.publish(JamEvent.builder(jamId, JamEventType.JAM_STATUS)
                .put(Protocol.E_STATUS, jam.status().wireName())
                .build());
        return new JamStatusResult(jamId, jam.status().wireName());
    }

    // Attendees

    /**
     * Join a jam under a display name. An existing name is re-bound to the caller's session. Anonymous
     * votes cast under the session token are claimed by the attendee.
     */
    public AttendeeRegistration registerAttendee(String jamId, String name, String sessionToken) {
        identity.requireJam(jamId);
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new JamSessionException.InvalidRequest("name is required");
        }
        String token = sessionToken == null || sessionToken.isBlank() ? null : sessionToken;

        AttendeeOutcome out = votes.call("register attendee",
                () -> votes.jamStore().upsertAttendee(jamId, trimmed, token, votes.clock().instant()));
        Attendee attendee = out.attendee();
        boolean created = out.status() == AttendeeOutcome.Status.CREATED;

        int claimed = token == null ? 0
                : votes.claimVotes(jamId, ActorId.session(token), ActorId.attendee(attendee.id()));
        logger.info("Attendee {} ({}) {} jam {}, claimed {} votes",
                attendee.name(), attendee.id(), created ? "joined" : "re-joined", jamId, claimed);

        hub.publish(JamEvent.builder(jamId, JamEventType.ATTENDEE_REGISTERED)
                .put(Protocol.E_ATTENDEE_ID, attendee.id())
                .put(Protocol.E_NAME, attendee.name())
                .build());
        if (claimed > 0) {
            hub.publish(JamEvent.builder(jamId, JamEventType.VOTE_UPDATE)
                    .put(Protocol.E_ATTENDEE_ID, attendee.id())
                    .put(Protocol.E_CLAIMED, claimed)
                    .build());
        }
        return new AttendeeRegistration(attendee.id(), attendee.name(), created, claimed);
    }

    /**
     * @param sessionToken when present, only the attendee bound to that session
     */
    public List<AttendeeSummary> attendees(String jamId, String sessionToken) {
        identity.requireJam(jamId);
        List<AttendeeSummary> out = new ArrayList<>();
        if (sessionToken != null && !sessionToken.isBlank()) {
            Optional<Attendee> bound = votes.call("find attendee by session",
                    () -> votes.jamStore().findAttendeeBySession(jamId, sessionToken));
            bound.ifPresent(a -> out.add(AttendeeSummary.of(a)));
            return out;
        }
        for (Attendee a : votes.call("list attendees", () -> votes.jamStore().attendees(jamId))) {
            out.add(AttendeeSummary.of(a));
        }
        return out;
    }

    // Helpers

    private List<RankedSong> rankedQueue(String jamId) {
        List<JamSong> songs = votes.call("list queue", () -> votes.jamStore().jamSongs(jamId));
        return ranking.rank(songs);
    }

    private Song requireSong(String songId) {
        if (songId == null || songId.isBlank()) {
            throw new JamSessionException.InvalidRequest("song_id is required");
        }
        JamStore store = votes.jamStore();
        return votes.call("find song", () -> store.findSong(songId))
                .orElseThrow(() -> new JamSessionException.UnknownSong(songId));
    }

    private JamSong requireQueued(String jamId, String songId) {
        requireSong(songId);
        return votes.call("find queued song", () -> votes.jamStore().findJamSong(jamId, songId))
                .orElseThrow(() -> new JamSessionException.SongNotInJam(songId));
    }
}
