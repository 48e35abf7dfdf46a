package world.willfrog.review.mcp;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallResult {
    private String toolName;
    private String serverName;
    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();
    private long durationMs;

    public Object get(String key) {
        return payload == null ? null : payload.get(key);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : String.valueOf(value);
    }
}
