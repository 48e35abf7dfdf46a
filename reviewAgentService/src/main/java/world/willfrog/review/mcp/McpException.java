package world.willfrog.review.mcp;

/**
 * MCP 调用异常基类。
 */
public class McpException extends RuntimeException {

    public McpException(String message) {
        super(message);
    }

    public McpException(String message, Throwable cause) {
        super(message, cause);
    }
}
