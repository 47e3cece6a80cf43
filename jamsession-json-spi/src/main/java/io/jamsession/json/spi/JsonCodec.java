package io.jamsession.json.spi;

import java.io.InputStream;
import java.util.Map;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>This interface intentionally avoids exposing tree model abstractions.
 * Request bodies are read as plain maps; responses and push payloads are written from records and maps.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON input stream to an object of the specified type.
     * @param input JSON input stream
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(InputStream input, Class<T> type) throws JsonException;

    /**
     * Reads a JSON object into a map with string keys.
     * @param json JSON string (must be an object)
     * @return the object's members in document order
     * @throws JsonException if the input is not a JSON object
     */
    Map<String, Object> readObject(String json) throws JsonException;

    /**
     * Reads a JSON object into a map with string keys.
     * @param input JSON input stream (must be an object)
     * @return the object's members in document order
     * @throws JsonException if the input is not a JSON object
     */
    Map<String, Object> readObject(InputStream input) throws JsonException;
}
