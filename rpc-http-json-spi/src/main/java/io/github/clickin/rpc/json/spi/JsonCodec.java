package io.github.clickin.rpc.json.spi;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Untyped reads ({@link #readValue(String)}) must produce plain Java values: {@link java.util.Map}
 * with {@code String} keys for objects (insertion ordered), {@link java.util.List} for arrays,
 * {@code String}, {@code Number}, {@code Boolean} or {@code null}.
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

    // ===== Deserialization =====

    /**
     * Deserializes JSON text into plain Java values.
     * @param json JSON string
     * @return the decoded value, {@code null} for a JSON {@code null}
     * @throws JsonException if the text is not valid JSON
     */
    default Object readValue(String json) throws JsonException {
        return readValue(json, Object.class);
    }

    /**
     * Deserializes JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;
}
