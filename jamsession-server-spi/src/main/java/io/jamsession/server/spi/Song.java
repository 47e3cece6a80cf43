package io.jamsession.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Catalog song. Jams reference songs; they never own them.
 *
 * @param lastPlayed null if the song was never played
 */
public record Song(String id, String title, String artist, int timesPlayed, Instant lastPlayed) {

    public Song {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
    }
}
