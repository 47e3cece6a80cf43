package io.jamsession.core;

import java.util.Optional;

/**
 * Event names carried in the {@code event} field of push frames.
 */
public enum JamEventType {
    VOTE_UPDATE("vote_update"),
    PERFORMANCE_UPDATE("performance_update"),
    SONG_ADDED("song_added"),
    ATTENDEE_REGISTERED("attendee_registered"),
    SONG_PLAYED("song_played"),
    JAM_STATUS("jam_status"),
    PONG("pong");

    private final String wireName;

    JamEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<JamEventType> fromWireName(String name) {
        if (name == null) return Optional.empty();
        for (JamEventType t : values()) {
            if (t.wireName.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
