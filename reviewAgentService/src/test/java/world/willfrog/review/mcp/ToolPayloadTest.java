package world.willfrog.review.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolPayloadTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void asMap_shouldParseJsonObjectText() {
        Map<String, Object> map = ToolPayload.raw("{\"status\":\"success\",\"results\":[{\"chunk_id\":\"c1\"}]}")
                .asMap(objectMapper);

        assertEquals("success", map.get("status"));
        assertEquals(List.of(Map.of("chunk_id", "c1")), map.get("results"));
    }

    @Test
    void asMap_shouldWrapTextThatIsNotAJsonObject() {
        assertEquals(Map.of("text", "[1,2]"), ToolPayload.raw("[1,2]").asMap(objectMapper));
        assertEquals(Map.of("text", "not json {"), ToolPayload.raw("not json {").asMap(objectMapper));
    }

    @Test
    void asMap_shouldReturnEmptyMapForEmptyContent() {
        assertTrue(ToolPayload.raw("  ").asMap(objectMapper).isEmpty());
        assertTrue(ToolPayload.empty().asMap(objectMapper).isEmpty());
    }
}
