package io.jamsession.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Push envelope {@code {event, data}} delivered to every connection watching a jam.
 *
 * <p>Receivers treat any event as "something changed" and refetch; the payload is informative only.
 *
 * @param jamId jam the event belongs to (not serialized into the envelope)
 * @param type event name
 * @param data event payload, serialized as a JSON object
 */
public record JamEvent(String jamId, JamEventType type, Map<String, Object> data) {

    public JamEvent {
        Objects.requireNonNull(jamId, "jamId");
        Objects.requireNonNull(type, "type");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Builder builder(String jamId, JamEventType type) {
        return new Builder(jamId, type);
    }

    /** Envelope as written on the wire. */
    public Map<String, Object> envelope() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(Protocol.F_EVENT, type.wireName());
        out.put(Protocol.F_DATA, data);
        return out;
    }

    /**
     * Builder that skips null values so optional payload fields are simply absent.
     */
    public static final class Builder {
        private final String jamId;
        private final JamEventType type;
        private final Map<String, Object> data = new LinkedHashMap<>();

        private Builder(String jamId, JamEventType type) {
            this.jamId = jamId;
            this.type = type;
        }

        public Builder put(String key, Object value) {
            if (value != null) data.put(key, value);
            return this;
        }

        public JamEvent build() {
            return new JamEvent(jamId, type, data);
        }
    }
}
