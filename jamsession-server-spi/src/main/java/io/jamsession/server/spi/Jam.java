package io.jamsession.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * A jam session.
 *
 * @param currentSongId song being played, or null
 */
public record Jam(String id, String name, String slug, JamStatus status, String currentSongId, Instant createdAt) {

    public Jam {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
    }

    public Jam withStatus(JamStatus newStatus) {
        return new Jam(id, name, slug, newStatus, currentSongId, createdAt);
    }

    public Jam withCurrentSong(String songId) {
        return new Jam(id, name, slug, status, songId, createdAt);
    }
}
