package io.recordstore.util;

import java.util.Map;

/**
 * Codec for record payloads to and from JSON documents.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) delegates to Jackson and
 * writes compact JSON. Stores that match payload fields against serialized text
 * rely on the codec producing the same form for every write.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a payload as a JSON object string.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    String toJson(Map<String, Object> data);

    /**
     * Parses a JSON object string. Returns an empty mutable map for {@code null} or empty input.
     *
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    Map<String, Object> parseObject(String json);

    /**
     * Encodes the single-member object {@code {field: value}}.
     */
    String toJsonMember(String field, Object value);

    /**
     * Returns the {@code "field":value} text exactly as {@link #toJson} writes it
     * inside an object.
     */
    String memberFragment(String field, Object value);

    /**
     * Returns {@code true} if {@code data} has a top-level {@code field} whose value is
     * structurally equal to {@code value} once both are expressed as JSON.
     */
    boolean containsMember(Map<String, Object> data, String field, Object value);
}
