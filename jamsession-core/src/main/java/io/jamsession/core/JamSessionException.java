package io.jamsession.core;

/**
 * Base class for jam session errors surfaced to callers.
 *
 * <p>Every subclass carries a stable machine-readable {@link #code()} and the HTTP status it maps to.
 * Client-error messages are meant to be shown to the user verbatim.
 */
public abstract class JamSessionException extends RuntimeException {

    private final String code;
    private final int httpStatus;

    protected JamSessionException(String code, int httpStatus, String message) {
        super(message);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    protected JamSessionException(String code, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Raised when a request is missing required fields or carries malformed values.
     */
    public static class InvalidRequest extends JamSessionException {
        public InvalidRequest(String message) {
            super("invalid_request", 400, message);
        }
    }

    /**
     * Raised when the jam id does not name an existing jam.
     */
    public static class UnknownJam extends JamSessionException {
        public UnknownJam(String jamId) {
            super("unknown_jam", 404, "Jam not found: " + jamId);
        }
    }

    /**
     * Raised when the song id does not name a catalog song.
     */
    public static class UnknownSong extends JamSessionException {
        public UnknownSong(String songId) {
            super("unknown_song", 404, "Song not found: " + songId);
        }
    }

    /**
     * Raised when an attendee id does not belong to the jam.
     */
    public static class UnknownAttendee extends JamSessionException {
        public UnknownAttendee(String attendeeId) {
            super("unknown_attendee", 404, "Attendee not found: " + attendeeId);
        }
    }

    /**
     * Raised when a song exists in the catalog but is not queued in the jam.
     */
    public static class SongNotInJam extends JamSessionException {
        public SongNotInJam(String songId) {
            super("song_not_in_jam", 400, "Song is not in this jam's queue: " + songId);
        }
    }

    /**
     * Raised when adding a song that is already queued.
     */
    public static class SongAlreadyInJam extends JamSessionException {
        public SongAlreadyInJam(String songId) {
            super("song_already_in_jam", 409, "Song is already in this jam's queue: " + songId);
        }
    }

    /**
     * Raised when an attendee registers twice for the same song.
     */
    public static class DuplicateRegistration extends JamSessionException {
        public DuplicateRegistration(String songId) {
            super("duplicate_registration", 409, "You are already registered to perform this song (" + songId + ")");
        }
    }

    /**
     * Raised when an attendee already holds the maximum number of performance slots in a jam.
     */
    public static class PerformanceLimitExceeded extends JamSessionException {
        private final int limit;

        public PerformanceLimitExceeded(int limit) {
            super("performance_limit_exceeded", 409,
                    "You can register to perform at most " + limit + " songs in this jam");
            this.limit = limit;
        }

        public int limit() {
            return limit;
        }
    }

    /**
     * Raised when unregistering from a song the attendee is not registered for.
     */
    public static class NotRegistered extends JamSessionException {
        public NotRegistered(String songId) {
            super("not_registered", 409, "You are not registered to perform this song (" + songId + ")");
        }
    }

    /**
     * Raised when the durable store cannot complete an operation, including after bounded retries.
     */
    public static class StoreUnavailable extends JamSessionException {
        public StoreUnavailable(String message, Throwable cause) {
            super("store_unavailable", 503, message, cause);
        }
    }
}
