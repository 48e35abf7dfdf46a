package world.willfrog.review.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import world.willfrog.review.config.McpProperties;
import world.willfrog.review.mcp.AllServersUnavailableException;
import world.willfrog.review.mcp.ToolInvoker;

/**
 * 启动完成后对全部 MCP server 握手并发现工具。失败不阻止启动，工具调用时会按需重连。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpStartupInitializer {

    private final ToolInvoker toolInvoker;
    private final McpProperties mcpProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void initialize() {
        if (!mcpProperties.isInitializeOnStartup()) {
            log.info("MCP startup initialization disabled");
            return;
        }
        try {
            toolInvoker.initializeAll();
            log.info("MCP servers initialized: states={}", toolInvoker.connectionStates());
        } catch (AllServersUnavailableException e) {
            log.error("No MCP server reachable at startup, tool calls will reconnect lazily: {}", e.getFailures());
        }
    }
}
