package io.jamsession.server.spi;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle state of a jam.
 */
public enum JamStatus {
    WAITING,
    PLAYING,
    PAUSED,
    ENDED;

    /** Lower-case name used in JSON bodies and the database. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<JamStatus> fromWireName(String value) {
        if (value == null) return Optional.empty();
        for (JamStatus s : values()) {
            if (s.wireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
