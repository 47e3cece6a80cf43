package io.jamsession.server.core;

import io.jamsession.core.ActorId;
import io.jamsession.core.JamSessionException;
import io.jamsession.core.Protocol;
import io.jamsession.server.spi.JamStore;
import io.jamsession.server.spi.PerformanceRegistration;
import io.jamsession.server.spi.RegistrationOutcome;
import io.jamsession.server.spi.ToggleOutcome;
import io.jamsession.server.spi.Vote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Vote and performance-registration facts of every jam, on top of a {@link JamStore}.
 *
 * <p>Store conflicts are retried a bounded number of times; store outcomes are turned into
 * {@link JamSessionException}s callers can show to users. Counts always come from the store's rows.
 *
 * <pre>{@code
 * VoteRegistrationStore votes = VoteRegistrationStore.builder(store)
 *     .maxPerformancesPerAttendee(3)
 *     .maxRetries(3)
 *     .build();
 * }</pre>
 */
public final class VoteRegistrationStore {
    private static final Logger logger = LoggerFactory.getLogger(VoteRegistrationStore.class);

    private final JamStore store;
    private final StoreRetrier retrier;
    private final int maxPerformances;
    private final Clock clock;

    public static Builder builder(JamStore store) {
        return new Builder(store);
    }

    private VoteRegistrationStore(Builder builder) {
        this.store = builder.store;
        this.retrier = new StoreRetrier(builder.maxRetries, builder.backoff);
        this.maxPerformances = builder.maxPerformances;
        this.clock = builder.clock;
    }

    public static final class Builder {
        private final JamStore store;
        private int maxPerformances = Protocol.DEFAULT_MAX_PERFORMANCES;
        private int maxRetries = StoreRetrier.DEFAULT_MAX_RETRIES;
        private Duration backoff = StoreRetrier.DEFAULT_BACKOFF;
        private Clock clock = Clock.systemUTC();

        private Builder(JamStore store) {
            this.store = Objects.requireNonNull(store, "store");
        }

        /** Concurrent registrations an attendee may hold per jam. Default: 3. */
        public Builder maxPerformancesPerAttendee(int maxPerformances) {
            if (maxPerformances < 1) throw new IllegalArgumentException("maxPerformances must be >= 1");
            this.maxPerformances = maxPerformances;
            return this;
        }

        /** Retries after a store conflict before giving up with 503. Default: 3. */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            this.maxRetries = maxRetries;
            return this;
        }

        /** Base delay between retries, multiplied by the attempt number. Default: 10 ms. */
        public Builder retryBackoff(Duration backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public VoteRegistrationStore build() {
            return new VoteRegistrationStore(this);
        }
    }

    public JamStore jamStore() {
        return store;
    }

    public int maxPerformancesPerAttendee() {
        return maxPerformances;
    }

    Clock clock() {
        return clock;
    }

    StoreRetrier retrier() {
        return retrier;
    }

    <T> T call(String operation, StoreCall<T> call) {
        return retrier.call(operation, call);
    }

    /**
     * Flip the actor's vote on a song.
     */
    public ToggleOutcome toggleVote(String jamId, String songId, ActorId actor) {
        ToggleOutcome out = call("toggle vote", () -> store.toggleVote(jamId, songId, actor, clock.instant()));
        logger.debug("Vote on {} in jam {} by {}: voted={} count={}",
                songId, jamId, actor.isAttendee() ? actor.key() : actor.kind().prefix(), out.voted(), out.voteCount());
        return out;
    }

    public boolean hasVoted(String jamId, String songId, ActorId actor) {
        return call("vote status", () -> store.hasVoted(jamId, songId, actor));
    }

    public int voteCount(String jamId, String songId) {
        return call("vote count", () -> store.voteCount(jamId, songId));
    }

    public List<Vote> votesBy(String jamId, ActorId actor) {
        return call("list votes", () -> store.votesBy(jamId, actor));
    }

    /**
     * Move anonymous votes onto a registered attendee; duplicates collapse into the attendee's vote.
     *
     * @return number of votes that now belong to {@code to}
     */
    public int claimVotes(String jamId, ActorId from, ActorId to) {
        if (from.equals(to)) return 0;
        return call("claim votes", () -> store.reassignVotes(jamId, from, to));
    }

    /**
     * @param instrument blank or null records {@link Protocol#DEFAULT_INSTRUMENT}
     * @throws JamSessionException.DuplicateRegistration if already registered for the song
     * @throws JamSessionException.PerformanceLimitExceeded if the attendee holds the maximum already
     */
    public RegistrationOutcome registerPerformance(String jamId, String songId, String attendeeId, String instrument) {
        String normalized = normalizeInstrument(instrument);
        RegistrationOutcome out = call("register performance",
                () -> store.registerPerformance(jamId, songId, attendeeId, normalized, maxPerformances, clock.instant()));
        return switch (out.status()) {
            case REGISTERED -> {
                logger.debug("Attendee {} registered for {} in jam {} ({} active)", attendeeId, songId, jamId, out.activeCount());
                yield out;
            }
            case DUPLICATE -> throw new JamSessionException.DuplicateRegistration(songId);
            case LIMIT_EXCEEDED -> throw new JamSessionException.PerformanceLimitExceeded(maxPerformances);
        };
    }

    /**
     * @return registrations the attendee still holds in the jam
     * @throws JamSessionException.NotRegistered if there was nothing to remove
     */
    public int unregisterPerformance(String jamId, String songId, String attendeeId) {
        boolean removed = call("unregister performance", () -> store.unregisterPerformance(jamId, songId, attendeeId));
        if (!removed) {
            throw new JamSessionException.NotRegistered(songId);
        }
        return registrationsOf(jamId, attendeeId).size();
    }

    /**
     * @param songId null lists every registration in the jam
     */
    public List<PerformanceRegistration> performers(String jamId, String songId) {
        return call("list performers", () -> store.performers(jamId, songId));
    }

    public List<PerformanceRegistration> registrationsOf(String jamId, String attendeeId) {
        return call("list registrations", () -> store.registrationsOf(jamId, attendeeId));
    }

    static String normalizeInstrument(String instrument) {
        if (instrument == null || instrument.isBlank()) return Protocol.DEFAULT_INSTRUMENT;
        return instrument.trim();
    }
}
