package world.willfrog.review.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import world.willfrog.review.mcp.McpToolException;

import java.util.Map;

/**
 * 从工具返回或异常中提取可读的错误信息，信息不足时附带原始内容，不静默丢弃。
 */
@Slf4j
public final class ErrorMessageExtractor {

    public static final String UNKNOWN_ERROR = "Unknown error";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ErrorMessageExtractor() {
    }

    /**
     * 依次尝试 error 字段（字符串 / 嵌套 message / 序列化值）、message 字段。
     * 空 payload 返回 "Unknown error"；非空但无可用字段时返回 "Unknown error: {payload}"。
     */
    public static String extract(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return UNKNOWN_ERROR;
        }
        Object error = payload.get("error");
        if (error instanceof String text && !text.isBlank()) {
            return text;
        }
        if (error instanceof Map<?, ?> nested) {
            Object message = nested.get("message");
            if (message != null && !String.valueOf(message).isBlank()) {
                return String.valueOf(message);
            }
        }
        if (error != null && !(error instanceof String)) {
            String rendered = toJson(error);
            if (!rendered.isBlank() && !"{}".equals(rendered) && !"null".equals(rendered)) {
                return rendered;
            }
        }
        Object message = payload.get("message");
        if (message != null && !String.valueOf(message).isBlank()) {
            return String.valueOf(message);
        }
        return UNKNOWN_ERROR + ": " + toJson(payload);
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return UNKNOWN_ERROR;
        }
        if (error instanceof McpToolException toolError) {
            return toolError.getReason() == null || toolError.getReason().isBlank()
                    ? toolError.getMessage()
                    : toolError.getReason();
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Failed to render error payload as json: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }
}
