package world.willfrog.review.mcp;

import java.util.Map;

/**
 * 工具执行失败：JSON-RPC 错误、工具返回 isError、响应格式异常、HTTP 非 2xx 或超时。
 */
public class McpToolException extends McpException {

    private final String toolName;
    private final String reason;
    private final Map<String, Object> details;
    /** 触发失败的 HTTP 状态码，非 HTTP 失败为 0。 */
    private final int httpStatus;

    public McpToolException(String toolName, String reason) {
        this(toolName, reason, Map.of(), 0, null);
    }

    public McpToolException(String toolName, String reason, Map<String, Object> details) {
        this(toolName, reason, details, 0, null);
    }

    public McpToolException(String toolName, String reason, Map<String, Object> details, Throwable cause) {
        this(toolName, reason, details, 0, cause);
    }

    public McpToolException(String toolName, String reason, Map<String, Object> details, int httpStatus, Throwable cause) {
        super("Tool '" + toolName + "' failed: " + reason, cause);
        this.toolName = toolName;
        this.reason = reason;
        this.details = details == null ? Map.of() : details;
        this.httpStatus = httpStatus;
    }

    public String getToolName() {
        return toolName;
    }

    public String getReason() {
        return reason;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isServerError() {
        return httpStatus >= 500;
    }
}
