package io.jamsession.server.spi;

import java.util.Objects;

/**
 * Result of queueing a song in a jam.
 */
public final class AddSongOutcome {

    public enum Status {
        ADDED,
        ALREADY_PRESENT
    }

    private final Status status;
    private final JamSong jamSong;

    public AddSongOutcome(Status status, JamSong jamSong) {
        this.status = Objects.requireNonNull(status, "status");
        this.jamSong = jamSong;
    }

    public Status status() {
        return status;
    }

    /** The queued entry; null when the song was already present. */
    public JamSong jamSong() {
        return jamSong;
    }
}
