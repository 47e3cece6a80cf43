package io.jamsession.core;

/**
 * Jam session wire constants (paths, JSON field names, event names and well-known values).
 *
 * <p>This module intentionally contains no HTTP client/server bindings and no JSON library dependencies.
 * It only models protocol-level concerns that are shared across clients and servers.
 */
public final class Protocol {
    private Protocol() {}

    // Path segments
    public static final String PATH_JAMS = "jams";
    public static final String PATH_BY_SLUG = "by-slug";
    public static final String PATH_VOTE = "vote";
    public static final String PATH_VOTE_STATUS = "vote-status";
    public static final String PATH_VOTES = "votes";
    public static final String PATH_PERFORM = "perform";
    public static final String PATH_PERFORMERS = "performers";
    public static final String PATH_SONGS = "songs";
    public static final String PATH_PLAY = "play";
    public static final String PATH_ATTENDEES = "attendees";
    public static final String PATH_STATUS = "status";
    public static final String PATH_WS = "ws";

    // Request fields (snake_case, as sent by browsers)
    public static final String F_SONG_ID = "song_id";
    public static final String F_ATTENDEE_ID = "attendee_id";
    public static final String F_SESSION_ID = "session_id";
    public static final String F_INSTRUMENT = "instrument";
    public static final String F_NAME = "name";
    public static final String F_STATUS = "status";

    // Push envelope fields
    public static final String F_EVENT = "event";
    public static final String F_DATA = "data";
    public static final String F_TYPE = "type";

    // Event payload fields (camelCase, like response bodies)
    public static final String E_SONG_ID = "songId";
    public static final String E_TITLE = "title";
    public static final String E_ARTIST = "artist";
    public static final String E_VOTED = "voted";
    public static final String E_VOTE_COUNT = "voteCount";
    public static final String E_ATTENDEE_ID = "attendeeId";
    public static final String E_ATTENDEE_NAME = "attendeeName";
    public static final String E_NAME = "name";
    public static final String E_INSTRUMENT = "instrument";
    public static final String E_ACTION = "action";
    public static final String E_ACTIVE_COUNT = "activeCount";
    public static final String E_CLAIMED = "claimed";
    public static final String E_STATUS = "status";

    // performance_update actions
    public static final String ACTION_REGISTERED = "registered";
    public static final String ACTION_UNREGISTERED = "unregistered";

    // Inbound push frame types
    public static final String TYPE_PING = "ping";

    // Error body fields
    public static final String F_ERROR = "error";
    public static final String F_MESSAGE = "message";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_X_ERROR = "X-Error";
    public static final String H_RETRY_AFTER = "Retry-After";
    public static final String H_X_MAX_SIZE = "X-Max-Size";
    public static final String H_X_FORWARDED_FOR = "X-Forwarded-For";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_JSON_UTF8 = "application/json; charset=utf-8";

    /** Cache directive applied to every jam session response; state is always refetched. */
    public static final String NO_STORE = "no-store";

    /** Instrument recorded when a performer does not name one. */
    public static final String DEFAULT_INSTRUMENT = "Unknown";

    /** Default cap on concurrent performance registrations per attendee and jam. */
    public static final int DEFAULT_MAX_PERFORMANCES = 3;
}
