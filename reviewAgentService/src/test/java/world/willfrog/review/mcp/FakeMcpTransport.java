package world.willfrog.review.mcp;

import world.willfrog.review.mcp.transport.McpSession;
import world.willfrog.review.mcp.transport.McpTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * 内存版 MCP 传输：记录打开的 server 地址，按 server 名称模拟握手失败与工具返回。
 */
class FakeMcpTransport implements McpTransport {

    final List<String> openedBaseUrls = Collections.synchronizedList(new ArrayList<>());
    final List<String> calledTools = Collections.synchronizedList(new ArrayList<>());
    final Map<String, AtomicInteger> handshakeFailuresRemaining = new ConcurrentHashMap<>();
    final Map<String, BiFunction<String, Map<String, Object>, ToolPayload>> handlers = new ConcurrentHashMap<>();
    final AtomicInteger closedSessions = new AtomicInteger();

    void failHandshakes(String serverName, int times) {
        handshakeFailuresRemaining.put(serverName, new AtomicInteger(times));
    }

    void onCall(String serverName, BiFunction<String, Map<String, Object>, ToolPayload> handler) {
        handlers.put(serverName, handler);
    }

    @Override
    public McpSession open(McpServerDefinition server, Duration timeout) {
        openedBaseUrls.add(server.baseUrl());
        return new FakeSession(server);
    }

    private class FakeSession implements McpSession {

        private final McpServerDefinition server;

        FakeSession(McpServerDefinition server) {
            this.server = server;
        }

        @Override
        public void initialize() {
            AtomicInteger remaining = handshakeFailuresRemaining.get(server.name());
            if (remaining != null && remaining.getAndDecrement() > 0) {
                throw new McpConnectionException(server.name(), "Connection refused");
            }
        }

        @Override
        public List<String> listTools() {
            return server.tools();
        }

        @Override
        public ToolPayload callTool(String toolName, Map<String, Object> arguments) {
            calledTools.add(toolName);
            BiFunction<String, Map<String, Object>, ToolPayload> handler = handlers.get(server.name());
            return handler == null ? ToolPayload.empty() : handler.apply(toolName, arguments);
        }

        @Override
        public void close() {
            closedSessions.incrementAndGet();
        }
    }
}
