package io.jamsession.server.core;

import io.jamsession.json.jackson.JacksonJsonCodec;
import io.jamsession.server.spi.Jam;
import io.jamsession.server.spi.JamStore;
import io.jamsession.server.spi.Song;
import io.jamsession.server.spi.StoreException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A jam with a queue of songs on an in-memory store, wired to a hub that delivers on the calling thread.
 */
final class JamFixture {
    static final Instant T0 = Instant.parse("2025-03-01T20:00:00Z");

    final JamStore store;
    final VoteRegistrationStore votes;
    final BroadcastHub hub;
    final JamSessionService service;
    final Jam jam;
    final List<Song> songs = new ArrayList<>();

    JamFixture(String... titles) throws StoreException {
        this(new InMemoryJamStore(), titles);
    }

    JamFixture(JamStore store, String... titles) throws StoreException {
        this.store = store;
        this.votes = VoteRegistrationStore.builder(store).build();
        this.hub = BroadcastHub.builder(new JacksonJsonCodec()).executor(Runnable::run).build();
        this.service = new JamSessionService(votes, hub);
        this.jam = store.createJam("Friday Jam", "friday-jam", T0);
        for (String title : titles) {
            Song song = store.createSong(title, "Artist of " + title);
            store.addSong(jam.id(), song.id(), T0);
            songs.add(song);
        }
    }

    String songId(int index) {
        return songs.get(index).id();
    }
}
