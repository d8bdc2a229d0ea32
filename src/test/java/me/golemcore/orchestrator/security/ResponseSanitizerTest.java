package me.golemcore.orchestrator.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseSanitizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ResponseSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = new ResponseSanitizer(objectMapper);
    }

    @Test
    void shouldRecognizeSensitiveKeys() {
        assertTrue(ResponseSanitizer.isSensitive("password"));
        assertTrue(ResponseSanitizer.isSensitive("Authorization"));
        assertTrue(ResponseSanitizer.isSensitive("api_key"));
        assertTrue(ResponseSanitizer.isSensitive("access-token"));
        assertTrue(ResponseSanitizer.isSensitive("JWT"));

        assertFalse(ResponseSanitizer.isSensitive("keywords"));
        assertFalse(ResponseSanitizer.isSensitive("monkey"));
        assertFalse(ResponseSanitizer.isSensitive("session_id"));
        assertFalse(ResponseSanitizer.isSensitive(null));
    }

    @Test
    void shouldRemoveSensitiveFieldsRecursively() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("name", "Ana");
        nested.put("secret", "s3cr3t");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("response", "ok");
        body.put("token", "abc");
        body.put("user", nested);
        body.put("items", List.of(Map.of("api_key", "k", "id", 1)));

        Map<String, Object> result = sanitizer.sanitize(body);

        assertEquals(Map.of("name", "Ana"), result.get("user"));
        assertEquals(List.of(Map.of("id", 1)), result.get("items"));
        assertFalse(result.containsKey("token"));
        assertEquals("ok", result.get("response"));
    }

    @Test
    void shouldNotModifyInput() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("password", "p");
        body.put("text", "hola");

        sanitizer.sanitize(body);

        assertTrue(body.containsKey("password"));
    }

    @Test
    void shouldSanitizeJsonTree() throws Exception {
        JsonNode payload = objectMapper.readTree("""
                {"response": "Su trámite está en curso",
                 "metadata": {"authorization": "Bearer x", "agent": "tramites"},
                 "steps": [{"jwt": "y", "n": 1}]}
                """);

        Map<String, Object> result = sanitizer.sanitize(payload);

        assertEquals("Su trámite está en curso", result.get("response"));
        assertEquals(Map.of("agent", "tramites"), result.get("metadata"));
        assertEquals(List.of(Map.of("n", 1)), result.get("steps"));
        assertTrue(payload.path("metadata").has("authorization"));
    }

    @Test
    void shouldReturnEmptyMapForNonObjectNode() throws Exception {
        assertTrue(sanitizer.sanitize(objectMapper.readTree("[1,2]")).isEmpty());
        assertTrue(sanitizer.sanitize((Map<String, ?>) null).isEmpty());
    }

    @Test
    void shouldStripSensitiveFieldsInsideEmbeddedJsonNode() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("payload", objectMapper.readTree("{\"secret\": 1, \"keep\": 2}"));

        Map<String, Object> result = sanitizer.sanitize(body);

        JsonNode payload = (JsonNode) result.get("payload");
        assertFalse(payload.has("secret"));
        assertEquals(2, payload.get("keep").asInt());
        assertTrue(((JsonNode) body.get("payload")).has("secret"));
    }
}
