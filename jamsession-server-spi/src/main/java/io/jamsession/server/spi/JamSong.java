package io.jamsession.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * A song queued in a jam, with its vote count aggregated from vote rows at read time.
 */
public record JamSong(String jamId, Song song, int voteCount, boolean played, Instant playedAt, Instant addedAt) {

    public JamSong {
        Objects.requireNonNull(jamId, "jamId");
        Objects.requireNonNull(song, "song");
        if (voteCount < 0) throw new IllegalArgumentException("voteCount must be >= 0");
    }

    public String songId() {
        return song.id();
    }

    public String title() {
        return song.title();
    }
}
