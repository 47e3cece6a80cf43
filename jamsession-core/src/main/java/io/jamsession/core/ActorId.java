package io.jamsession.core;

import java.util.Objects;

/**
 * Uniqueness key for votes: either a registered attendee or an anonymous browser session.
 *
 * <p>The two kinds live in separate namespaces; {@link #key()} prefixes the raw value with the kind so an
 * attendee id can never collide with a session token that happens to carry the same text.
 *
 * <p>Session tokens are bearer credentials: {@link #toString()} never prints them, only {@link #key()}
 * and {@link #value()} do.
 */
public final class ActorId {

    public enum Kind {
        ATTENDEE("attendee"),
        SESSION("session");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    private final Kind kind;
    private final String value;

    private ActorId(Kind kind, String value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = validate(value);
    }

    public static ActorId attendee(String attendeeId) {
        return new ActorId(Kind.ATTENDEE, attendeeId);
    }

    public static ActorId session(String sessionToken) {
        return new ActorId(Kind.SESSION, sessionToken);
    }

    /**
     * Parses a value produced by {@link #key()}.
     *
     * @throws IllegalArgumentException if the key has no known prefix
     */
    public static ActorId parse(String key) {
        Objects.requireNonNull(key, "key");
        int colon = key.indexOf(':');
        if (colon <= 0) throw new IllegalArgumentException("malformed actor key: " + key);
        String prefix = key.substring(0, colon);
        String raw = key.substring(colon + 1);
        for (Kind k : Kind.values()) {
            if (k.prefix.equals(prefix)) return new ActorId(k, raw);
        }
        throw new IllegalArgumentException("unknown actor kind: " + prefix);
    }

    public Kind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    public boolean isAttendee() {
        return kind == Kind.ATTENDEE;
    }

    /** Storage key, e.g. {@code attendee:42} or {@code session:3f9c}. */
    public String key() {
        return kind.prefix + ":" + value;
    }

    private static String validate(String v) {
        Objects.requireNonNull(v, "actor id");
        if (v.isBlank()) {
            throw new IllegalArgumentException("actor id must not be blank");
        }
        return v;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ActorId)) return false;
        ActorId o = (ActorId) other;
        return kind == o.kind && value.equals(o.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    /** Log-safe form: attendee ids are printed, session tokens are masked. */
    @Override
    public String toString() {
        return kind == Kind.SESSION ? kind.prefix + ":***" : key();
    }
}
