package world.willfrog.review.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RPC 边界上的工具返回内容：结构化对象或原始文本。
 */
@Slf4j
public final class ToolPayload {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public enum Kind {
        STRUCTURED,
        RAW
    }

    private final Kind kind;
    private final Map<String, Object> structured;
    private final String raw;

    private ToolPayload(Kind kind, Map<String, Object> structured, String raw) {
        this.kind = kind;
        this.structured = structured;
        this.raw = raw;
    }

    public static ToolPayload structured(Map<String, Object> value) {
        return new ToolPayload(Kind.STRUCTURED, value == null ? Map.of() : value, null);
    }

    public static ToolPayload raw(String text) {
        return new ToolPayload(Kind.RAW, null, text == null ? "" : text);
    }

    public static ToolPayload empty() {
        return structured(Map.of());
    }

    public Kind getKind() {
        return kind;
    }

    public String getRaw() {
        return raw;
    }

    /**
     * 统一为 map：文本能解析为 JSON 对象则用解析结果，否则包装为 {"text": raw}；空内容为空 map。
     */
    public Map<String, Object> asMap(ObjectMapper objectMapper) {
        if (kind == Kind.STRUCTURED) {
            return new LinkedHashMap<>(structured);
        }
        if (raw.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node != null && node.isObject()) {
                return objectMapper.convertValue(node, MAP_TYPE);
            }
        } catch (JsonProcessingException e) {
            log.debug("Tool text is not JSON, wrapping as text: {}", e.getOriginalMessage());
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("text", raw);
        return wrapped;
    }
}
