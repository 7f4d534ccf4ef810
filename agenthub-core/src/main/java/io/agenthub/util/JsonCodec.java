package io.agenthub.util;

import java.util.Map;

/**
 * Codec between JSON text and plain Java values.
 *
 * <p>Values are limited to what JSON can express: {@code String}, {@code Long}
 * (integral numbers), {@code Double}, {@code Boolean}, {@code null}, {@code List}
 * and {@code Map<String, Object>}. The default implementation ({@link DefaultJsonCodec})
 * has no external dependencies. Users who already have Jackson or Gson on the
 * classpath can implement this interface to delegate to their preferred library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value tree as JSON text.
     *
     * @param value map, list, string, number, boolean or {@code null}
     * @return JSON text (never {@code null}; a {@code null} value encodes as {@code "null"})
     * @throws IllegalArgumentException if the tree contains an unsupported type
     */
    String toJson(Object value);

    /**
     * Parses JSON text into a value tree. Objects become insertion-ordered maps,
     * integral numbers become {@code Long}, other numbers {@code Double}.
     *
     * @param json the JSON text
     * @return parsed value, {@code null} for JSON {@code null}
     * @throws IllegalArgumentException if the input is not valid JSON
     */
    Object parse(String json);

    /**
     * Parses a JSON object. Returns an empty map for {@code null}, empty,
     * or {@code "null"} input.
     *
     * @param json the JSON text
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    @SuppressWarnings("unchecked")
    default Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return new java.util.LinkedHashMap<>();
        }
        Object value = parse(json);
        if (value == null) {
            return new java.util.LinkedHashMap<>();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected JSON object");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Round-trips a value through JSON so that it holds only the canonical value types.
     * Every record store applies this before storing, which keeps reads identical
     * across backends.
     *
     * @param record the record fields
     * @return a canonical deep copy
     */
    default Map<String, Object> normalize(Map<String, Object> record) {
        return parseObject(toJson(record));
    }
}
