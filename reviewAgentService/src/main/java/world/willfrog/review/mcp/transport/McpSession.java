package world.willfrog.review.mcp.transport;

import world.willfrog.review.mcp.ToolPayload;

import java.util.List;
import java.util.Map;

/**
 * 一次 MCP session。
 * <p>
 * 传输层失败抛 {@link world.willfrog.review.mcp.McpConnectionException}，
 * 工具层失败抛 {@link world.willfrog.review.mcp.McpToolException}。
 */
public interface McpSession extends AutoCloseable {

    /**
     * initialize 握手 + notifications/initialized。
     */
    void initialize();

    List<String> listTools();

    ToolPayload callTool(String toolName, Map<String, Object> arguments);

    /**
     * 结束 session，失败只记录日志。
     */
    @Override
    void close();
}
