package io.eventstreams.json.spi;

/**
 * Minimal JSON codec interface used to turn event payloads into typed values and back.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Failures are reported as {@link JsonException} and are passed through the event stream
 * readers unchanged, so a caller sees exactly what the codec raised for the offending item.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array (UTF-8).
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
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object, never {@code null}
     * @throws JsonException if deserialization fails, including for a top-level JSON {@code null}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object, never {@code null}
     * @throws JsonException if deserialization fails, including for a top-level JSON {@code null}
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * The encoding options this codec was built with.
     */
    JsonEncodingOptions options();
}
