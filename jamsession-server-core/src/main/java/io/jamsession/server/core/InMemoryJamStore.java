package io.jamsession.server.core;

import io.jamsession.core.ActorId;
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
import io.jamsession.server.spi.StoreConflictException;
import io.jamsession.server.spi.StoreException;
import io.jamsession.server.spi.ToggleOutcome;
import io.jamsession.server.spi.Vote;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reference in-memory {@link JamStore}.
 *
 * <p>Good for unit tests, examples and single-node demos. State of each jam lives in its own concurrent
 * maps; there is no global lock. A vote toggle is a remove-else-insert loop on the song's voter map, and
 * the per-attendee registration limit is checked and applied inside a single
 * {@link ConcurrentHashMap#compute} on the attendee's entry.
 */
public final class InMemoryJamStore implements JamStore {

    private final Map<String, Jam> jams = new ConcurrentHashMap<>();
    private final Map<String, String> jamIdsBySlug = new ConcurrentHashMap<>();
    private final Map<String, Song> songs = new ConcurrentHashMap<>();
    private final Map<String, JamState> states = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    // Jams

    @Override
    public Jam createJam(String name, String slug, Instant now) throws StoreException {
        Objects.requireNonNull(slug, "slug");
        Jam jam = new Jam(newId(), name, slug, JamStatus.WAITING, null, now);
        if (jamIdsBySlug.putIfAbsent(slug, jam.id()) != null) {
            throw new StoreConflictException("Slug already in use: " + slug);
        }
        states.put(jam.id(), new JamState());
        jams.put(jam.id(), jam);
        return jam;
    }

    @Override
    public Optional<Jam> findJam(String jamId) {
        return Optional.ofNullable(jams.get(jamId));
    }

    @Override
    public Optional<Jam> findJamBySlug(String slug) {
        String jamId = slug == null ? null : jamIdsBySlug.get(slug);
        return jamId == null ? Optional.empty() : findJam(jamId);
    }

    @Override
    public Optional<Jam> updateJamStatus(String jamId, JamStatus status) {
        return Optional.ofNullable(jams.computeIfPresent(jamId, (id, jam) -> jam.withStatus(status)));
    }

    // Catalog

    @Override
    public Song createSong(String title, String artist) {
        Song song = new Song(newId(), title, artist, 0, null);
        songs.put(song.id(), song);
        return song;
    }

    @Override
    public Optional<Song> findSong(String songId) {
        return Optional.ofNullable(songs.get(songId));
    }

    // Queue

    @Override
    public AddSongOutcome addSong(String jamId, String songId, Instant now) throws StoreException {
        JamState state = state(jamId);
        Song song = song(songId);
        Queued entry = new Queued(songId, sequence.incrementAndGet(), now, false, null);
        if (state.queue.putIfAbsent(songId, entry) != null) {
            return new AddSongOutcome(AddSongOutcome.Status.ALREADY_PRESENT, null);
        }
        state.voters.putIfAbsent(songId, new ConcurrentHashMap<>());
        return new AddSongOutcome(AddSongOutcome.Status.ADDED, toJamSong(jamId, state, entry, song));
    }

    @Override
    public List<JamSong> jamSongs(String jamId) throws StoreException {
        JamState state = state(jamId);
        List<Queued> entries = new ArrayList<>(state.queue.values());
        entries.sort(Comparator.comparingLong(Queued::seq));
        List<JamSong> out = new ArrayList<>(entries.size());
        for (Queued q : entries) {
            out.add(toJamSong(jamId, state, q, song(q.songId())));
        }
        return out;
    }

    @Override
    public Optional<JamSong> findJamSong(String jamId, String songId) throws StoreException {
        JamState state = state(jamId);
        Queued q = state.queue.get(songId);
        if (q == null) return Optional.empty();
        return Optional.of(toJamSong(jamId, state, q, song(songId)));
    }

    @Override
    public boolean markPlayed(String jamId, String songId, Instant now) throws StoreException {
        JamState state = state(jamId);
        Queued updated = state.queue.computeIfPresent(songId, (id, q) -> q.markPlayed(now));
        if (updated == null) return false;
        jams.computeIfPresent(jamId, (id, jam) -> jam.withCurrentSong(songId));
        songs.computeIfPresent(songId, (id, s) -> new Song(s.id(), s.title(), s.artist(), s.timesPlayed() + 1, now));
        return true;
    }

    // Attendees

    @Override
    public AttendeeOutcome upsertAttendee(String jamId, String name, String sessionToken, Instant now) throws StoreException {
        JamState state = state(jamId);
        synchronized (state.attendees) {
            if (sessionToken != null) {
                for (Map.Entry<String, Attendee> e : state.attendees.entrySet()) {
                    Attendee other = e.getValue();
                    if (sessionToken.equals(other.sessionToken()) && !other.name().equals(name)) {
                        e.setValue(new Attendee(other.id(), jamId, other.name(), null, other.registeredAt()));
                    }
                }
            }
            for (Map.Entry<String, Attendee> e : state.attendees.entrySet()) {
                Attendee existing = e.getValue();
                if (existing.name().equals(name)) {
                    Attendee rebound = new Attendee(existing.id(), jamId, name, sessionToken, existing.registeredAt());
                    e.setValue(rebound);
                    return new AttendeeOutcome(AttendeeOutcome.Status.UPDATED, rebound);
                }
            }
            Attendee created = new Attendee(newId(), jamId, name, sessionToken, now);
            state.attendees.put(created.id(), created);
            return new AttendeeOutcome(AttendeeOutcome.Status.CREATED, created);
        }
    }

    @Override
    public Optional<Attendee> findAttendee(String jamId, String attendeeId) throws StoreException {
        return Optional.ofNullable(state(jamId).attendees.get(attendeeId));
    }

    @Override
    public Optional<Attendee> findAttendeeBySession(String jamId, String sessionToken) throws StoreException {
        if (sessionToken == null) return Optional.empty();
        JamState state = state(jamId);
        synchronized (state.attendees) {
            for (Attendee a : state.attendees.values()) {
                if (sessionToken.equals(a.sessionToken())) return Optional.of(a);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Attendee> attendees(String jamId) throws StoreException {
        List<Attendee> out;
        JamState state = state(jamId);
        synchronized (state.attendees) {
            out = new ArrayList<>(state.attendees.values());
        }
        out.sort(Comparator.comparing(Attendee::registeredAt));
        return out;
    }

    // Votes

    @Override
    public ToggleOutcome toggleVote(String jamId, String songId, ActorId actor, Instant now) throws StoreException {
        ConcurrentMap<String, Instant> voters = voters(jamId, songId);
        String key = actor.key();
        while (true) {
            if (voters.remove(key) != null) {
                return new ToggleOutcome(false, voters.size());
            }
            if (voters.putIfAbsent(key, now) == null) {
                return new ToggleOutcome(true, voters.size());
            }
            // lost a race with a concurrent toggle of the same key; look again
        }
    }

    @Override
    public boolean hasVoted(String jamId, String songId, ActorId actor) throws StoreException {
        return voters(jamId, songId).containsKey(actor.key());
    }

    @Override
    public int voteCount(String jamId, String songId) throws StoreException {
        return voters(jamId, songId).size();
    }

    @Override
    public List<Vote> votesBy(String jamId, ActorId actor) throws StoreException {
        JamState state = state(jamId);
        List<Vote> out = new ArrayList<>();
        for (Map.Entry<String, ConcurrentMap<String, Instant>> e : state.voters.entrySet()) {
            Instant at = e.getValue().get(actor.key());
            if (at != null) out.add(new Vote(jamId, e.getKey(), actor, at));
        }
        out.sort(Comparator.comparing(Vote::votedAt).thenComparing(Vote::songId));
        return out;
    }

    @Override
    public int reassignVotes(String jamId, ActorId from, ActorId to) throws StoreException {
        JamState state = state(jamId);
        int moved = 0;
        for (ConcurrentMap<String, Instant> voters : state.voters.values()) {
            Instant at = voters.remove(from.key());
            if (at != null && voters.putIfAbsent(to.key(), at) == null) {
                moved++;
            }
        }
        return moved;
    }

    // Performance registrations

    @Override
    public RegistrationOutcome registerPerformance(String jamId, String songId, String attendeeId, String instrument,
                                                   int limit, Instant now) throws StoreException {
        JamState state = state(jamId);
        Attendee attendee = state.attendees.get(attendeeId);
        String attendeeName = attendee != null ? attendee.name() : null;
        RegistrationOutcome[] result = new RegistrationOutcome[1];
        state.registrations.compute(attendeeId, (id, current) -> {
            Map<String, PerformanceRegistration> held = current != null ? current : Map.of();
            if (held.containsKey(songId)) {
                result[0] = RegistrationOutcome.duplicate(held.size());
                return current;
            }
            if (held.size() >= limit) {
                result[0] = RegistrationOutcome.limitExceeded(held.size());
                return current;
            }
            Map<String, PerformanceRegistration> next = new LinkedHashMap<>(held);
            PerformanceRegistration reg = new PerformanceRegistration(jamId, songId, attendeeId, attendeeName, instrument, now);
            next.put(songId, reg);
            result[0] = RegistrationOutcome.registered(reg, next.size());
            return Collections.unmodifiableMap(next);
        });
        return result[0];
    }

    @Override
    public boolean unregisterPerformance(String jamId, String songId, String attendeeId) throws StoreException {
        JamState state = state(jamId);
        boolean[] removed = new boolean[1];
        state.registrations.computeIfPresent(attendeeId, (id, current) -> {
            if (!current.containsKey(songId)) return current;
            removed[0] = true;
            Map<String, PerformanceRegistration> next = new LinkedHashMap<>(current);
            next.remove(songId);
            return next.isEmpty() ? null : Collections.unmodifiableMap(next);
        });
        return removed[0];
    }

    @Override
    public List<PerformanceRegistration> performers(String jamId, String songId) throws StoreException {
        List<PerformanceRegistration> out = new ArrayList<>();
        for (Map<String, PerformanceRegistration> held : state(jamId).registrations.values()) {
            for (PerformanceRegistration reg : held.values()) {
                if (songId == null || songId.equals(reg.songId())) out.add(reg);
            }
        }
        out.sort(Comparator.comparing(PerformanceRegistration::registeredAt)
                .thenComparing(PerformanceRegistration::attendeeId)
                .thenComparing(PerformanceRegistration::songId));
        return out;
    }

    @Override
    public List<PerformanceRegistration> registrationsOf(String jamId, String attendeeId) throws StoreException {
        Map<String, PerformanceRegistration> held = state(jamId).registrations.get(attendeeId);
        return held == null ? List.of() : List.copyOf(held.values());
    }

    // Internals

    private JamState state(String jamId) throws StoreException {
        JamState state = jamId == null ? null : states.get(jamId);
        if (state == null) throw new StoreException("Unknown jam: " + jamId);
        return state;
    }

    private Song song(String songId) throws StoreException {
        Song song = songId == null ? null : songs.get(songId);
        if (song == null) throw new StoreException("Unknown song: " + songId);
        return song;
    }

    private ConcurrentMap<String, Instant> voters(String jamId, String songId) throws StoreException {
        ConcurrentMap<String, Instant> voters = state(jamId).voters.get(songId);
        if (voters == null) throw new StoreException("Song " + songId + " is not queued in jam " + jamId);
        return voters;
    }

    private static JamSong toJamSong(String jamId, JamState state, Queued q, Song song) {
        ConcurrentMap<String, Instant> voters = state.voters.get(q.songId());
        int count = voters == null ? 0 : voters.size();
        return new JamSong(jamId, song, count, q.played(), q.playedAt(), q.addedAt());
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static final class JamState {
        final ConcurrentMap<String, Queued> queue = new ConcurrentHashMap<>();
        final ConcurrentMap<String, ConcurrentMap<String, Instant>> voters = new ConcurrentHashMap<>();
        final Map<String, Attendee> attendees = Collections.synchronizedMap(new LinkedHashMap<>());
        final ConcurrentMap<String, Map<String, PerformanceRegistration>> registrations = new ConcurrentHashMap<>();
    }

    private record Queued(String songId, long seq, Instant addedAt, boolean played, Instant playedAt) {
        Queued {
            Objects.requireNonNull(songId, "songId");
        }

        Queued markPlayed(Instant at) {
            return new Queued(songId, seq, addedAt, true, at);
        }
    }
}
