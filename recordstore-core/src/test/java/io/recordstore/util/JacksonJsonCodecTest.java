package io.recordstore.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonJsonCodecTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void writesCompactJsonInInsertionOrder() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("uid", "u1");
        data.put("accountId", 42);
        data.put("scopes", List.of("openid", "email"));

        assertEquals("{\"uid\":\"u1\",\"accountId\":42,\"scopes\":[\"openid\",\"email\"]}",
                codec.toJson(data));
    }

    @Test
    void instantsAreWrittenAsIsoStrings() {
        Map<String, Object> data = Map.of("consumed", Instant.parse("2024-05-01T10:15:30Z"));

        assertEquals("{\"consumed\":\"2024-05-01T10:15:30Z\"}", codec.toJson(data));
    }

    @Test
    void parseKeepsNestedStructure() {
        Map<String, Object> parsed = codec.parseObject(
                "{\"grantId\":\"g1\",\"claims\":{\"sub\":\"alice\"},\"exp\":1700000000}");

        assertEquals("g1", parsed.get("grantId"));
        assertEquals(Map.of("sub", "alice"), parsed.get("claims"));
        assertEquals(1700000000, ((Number) parsed.get("exp")).intValue());
    }

    @Test
    void parseEmptyInputReturnsMutableMap() {
        Map<String, Object> fromNull = codec.parseObject(null);
        Map<String, Object> fromEmpty = codec.parseObject("");

        assertTrue(fromNull.isEmpty());
        assertTrue(fromEmpty.isEmpty());
        fromNull.put("k", "v");
        assertEquals("v", fromNull.get("k"));
    }

    @Test
    void parseRejectsNonObjects() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{broken"));
    }

    @Test
    void memberFragmentMatchesSerializedPayload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("kind", "Session");
        data.put("uid", "a\"b");

        String fragment = codec.memberFragment("uid", "a\"b");

        assertEquals("\"uid\":\"a\\\"b\"", fragment);
        assertTrue(codec.toJson(data).contains(fragment));
        assertEquals("{" + fragment + "}", codec.toJsonMember("uid", "a\"b"));
    }

    @Test
    void containsMemberComparesJsonValues() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("grantId", "g1");
        data.put("count", 1L);
        data.put("nested", Map.of("a", List.of(1, 2)));

        assertTrue(codec.containsMember(data, "grantId", "g1"));
        assertTrue(codec.containsMember(data, "count", 1));
        assertTrue(codec.containsMember(data, "nested", Map.of("a", List.of(1L, 2L))));
        assertFalse(codec.containsMember(data, "grantId", "g2"));
        assertFalse(codec.containsMember(data, "count", "1"));
        assertFalse(codec.containsMember(data, "missing", "g1"));
        assertFalse(codec.containsMember(null, "grantId", "g1"));
    }

    @Test
    void customMapperIsUsed() {
        JsonCodec custom = new JacksonJsonCodec(new ObjectMapper());

        assertEquals("{\"a\":1}", custom.toJson(Map.of("a", 1)));
        assertThrows(NullPointerException.class, () -> new JacksonJsonCodec(null));
    }
}
