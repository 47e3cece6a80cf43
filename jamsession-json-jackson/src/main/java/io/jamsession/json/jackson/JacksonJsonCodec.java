package io.jamsession.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.jamsession.json.spi.JsonCodec;
import io.jamsession.json.spi.JsonException;

import java.io.InputStream;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 *
 * <p>The default mapper writes {@link java.time.Instant} values as ISO-8601 strings, omits null members
 * and ignores unknown members when reading.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to " + type.getName(), e);
        }
    }

    @Override
    public <T> T readValue(InputStream input, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(input, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize input stream to " + type.getName(), e);
        }
    }

    @Override
    public Map<String, Object> readObject(String json) throws JsonException {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON object", e);
        }
        return toObject(node);
    }

    @Override
    public Map<String, Object> readObject(InputStream input) throws JsonException {
        JsonNode node;
        try {
            node = mapper.readTree(input);
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON object", e);
        }
        return toObject(node);
    }

    private Map<String, Object> toObject(JsonNode node) throws JsonException {
        if (node == null || node.isMissingNode()) {
            throw new JsonException("Invalid JSON: no content");
        }
        if (!node.isObject()) {
            throw new JsonException("Expected a JSON object but found " + node.getNodeType());
        }
        return mapper.convertValue(node, OBJECT_TYPE);
    }
}
