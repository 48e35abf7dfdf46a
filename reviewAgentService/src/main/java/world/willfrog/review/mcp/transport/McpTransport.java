package world.willfrog.review.mcp.transport;

import world.willfrog.review.mcp.McpServerDefinition;

import java.time.Duration;

/**
 * 打开到某个 server 的新 session。每次工具调用都使用独立 session。
 */
public interface McpTransport {

    McpSession open(McpServerDefinition server, Duration timeout);
}
