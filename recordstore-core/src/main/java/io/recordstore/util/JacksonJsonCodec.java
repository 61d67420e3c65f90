package io.recordstore.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>{@link java.time} values are written as ISO-8601 strings.
 */
public final class JacksonJsonCodec implements JsonCodec {

    static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultMapper());

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    private static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String toJson(Map<String, Object> data) {
        Objects.requireNonNull(data, "data");
        return write(data);
    }

    @Override
    public Map<String, Object> parseObject(String json) {
        if (json == null || json.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> parsed = mapper.readValue(json, MAP_TYPE);
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON object: " + abbreviate(json), e);
        }
    }

    @Override
    public String toJsonMember(String field, Object value) {
        Objects.requireNonNull(field, "field");
        return write(Collections.singletonMap(field, value));
    }

    @Override
    public String memberFragment(String field, Object value) {
        String member = toJsonMember(field, value);
        // strip the enclosing braces
        return member.substring(1, member.length() - 1);
    }

    @Override
    public boolean containsMember(Map<String, Object> data, String field, Object value) {
        if (data == null || !data.containsKey(field)) {
            return false;
        }
        return normalize(data.get(field)).equals(normalize(value));
    }

    // Round-trip through text so that Integer 1 and Long 1 compare equal.
    private JsonNode normalize(Object value) {
        try {
            return mapper.readTree(write(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot normalize value for comparison", e);
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize value as JSON", e);
        }
    }

    private static String abbreviate(String json) {
        return json.length() <= 64 ? json : json.substring(0, 61) + "...";
    }
}
