package world.willfrog.review.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.review.config.McpProperties;
import world.willfrog.review.mcp.transport.McpSession;
import world.willfrog.review.mcp.transport.McpTransport;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * MCP 工具调用入口。
 * <p>
 * 职责：
 * 1. 按工具名路由到唯一的 server；
 * 2. server 处于断开状态时先按退避策略重连；
 * 3. 每次调用使用独立 session，结束后关闭；
 * 4. 维护 {@link ServerConnectionState}：成功清零失败计数，失败累加并记录原因。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolInvoker {

    /** server 注册表与工具路由。 */
    private final ConnectionRegistry connectionRegistry;
    /** session 传输实现。 */
    private final McpTransport transport;
    /** 超时与退避配置。 */
    private final McpProperties mcpProperties;
    private final ObjectMapper objectMapper;

    public ToolCallResult invoke(String toolName, Map<String, Object> arguments) {
        return invoke(toolName, arguments, null);
    }

    /**
     * 调用工具。
     *
     * @param toolName  工具名
     * @param arguments 工具参数
     * @param timeout   本次调用超时，null 时使用默认值
     * @return 统一为 map 的成功结果
     * @throws UnknownToolException   工具未映射
     * @throws McpConnectionException server 不可达或 session 失效
     * @throws McpToolException       工具执行失败或超时
     */
    public ToolCallResult invoke(String toolName, Map<String, Object> arguments, Duration timeout) {
        McpServerDefinition server = connectionRegistry.resolve(toolName);
        ServerConnectionState state = connectionRegistry.state(server.name());
        Duration effective = effectiveTimeout(timeout);

        if (!state.isConnected()) {
            log.info("MCP server not connected, reconnecting: server={}, tool={}", server.name(), toolName);
            withHandshakeRetry(server, state, effective, session -> null);
        }

        long start = System.nanoTime();
        try (McpSession session = transport.open(server, effective)) {
            session.initialize();
            ToolPayload payload = session.callTool(toolName, arguments == null ? Map.of() : arguments);
            state.markSuccess();
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            log.debug("MCP tool call succeeded: server={}, tool={}, durationMs={}", server.name(), toolName, durationMs);
            return ToolCallResult.builder()
                    .toolName(toolName)
                    .serverName(server.name())
                    .payload(payload.asMap(objectMapper))
                    .durationMs(durationMs)
                    .build();
        } catch (McpConnectionException e) {
            state.markFailure(e.getMessage(), true);
            log.warn("MCP connection failure: server={}, tool={}, failures={}, error={}",
                    server.name(), toolName, state.getConsecutiveFailures(), e.getMessage());
            throw e;
        } catch (McpToolException e) {
            state.markFailure(e.getMessage(), e.isServerError());
            log.warn("MCP tool failure: server={}, tool={}, failures={}, error={}",
                    server.name(), toolName, state.getConsecutiveFailures(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            state.markFailure(message, false);
            log.warn("MCP tool call raised unexpected error: server={}, tool={}, error={}", server.name(), toolName, message);
            throw new McpToolException(toolName, message, Map.of("server", server.name()), e);
        }
    }

    /**
     * 仅做握手的健康检查，不抛异常。
     */
    public boolean checkHealth(String serverName) {
        McpServerDefinition server = connectionRegistry.server(serverName);
        if (server == null) {
            log.warn("Health check for unknown MCP server: {}", serverName);
            return false;
        }
        ServerConnectionState state = connectionRegistry.state(serverName);
        try (McpSession session = transport.open(server, effectiveTimeout(null))) {
            session.initialize();
            state.markSuccess();
            return true;
        } catch (RuntimeException e) {
            state.markFailure(e.getMessage(), true);
            log.warn("MCP health check failed: server={}, error={}", serverName, e.getMessage());
            return false;
        }
    }

    public Map<String, Boolean> checkAllHealth() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (McpServerDefinition server : connectionRegistry.servers()) {
            result.put(server.name(), checkHealth(server.name()));
        }
        return result;
    }

    /**
     * 启动时对全部 server 握手并发现工具。部分失败只记录日志，全部失败才抛异常。
     *
     * @throws AllServersUnavailableException 所有 server 均不可用
     */
    public void initializeAll() {
        List<McpServerDefinition> servers = connectionRegistry.servers();
        Map<String, String> failures = new LinkedHashMap<>();
        for (McpServerDefinition server : servers) {
            ServerConnectionState state = connectionRegistry.state(server.name());
            try {
                List<String> tools = withHandshakeRetry(server, state, effectiveTimeout(null), McpSession::listTools);
                state.updateTools(tools);
                log.info("MCP server initialized: server={}, tools={}", server.name(), tools);
            } catch (McpException e) {
                failures.put(server.name(), e.getMessage());
                log.error("MCP server initialization failed: server={}, error={}", server.name(), e.getMessage());
            }
        }
        if (!servers.isEmpty() && failures.size() == servers.size()) {
            throw new AllServersUnavailableException(failures);
        }
    }

    public Set<String> availableTools() {
        return connectionRegistry.availableTools();
    }

    public Map<String, ServerConnectionState.Snapshot> connectionStates() {
        return connectionRegistry.snapshots();
    }

    private <T> T withHandshakeRetry(McpServerDefinition server,
                                     ServerConnectionState state,
                                     Duration timeout,
                                     Function<McpSession, T> action) {
        BackoffPolicy backoff = BackoffPolicy.from(mcpProperties.getRetry());
        McpException last = null;
        for (int attempt = 1; attempt <= backoff.maxAttempts(); attempt++) {
            sleep(server, backoff.delayBeforeAttempt(attempt));
            try (McpSession session = transport.open(server, timeout)) {
                session.initialize();
                T value = action.apply(session);
                state.markSuccess();
                return value;
            } catch (McpException e) {
                last = e;
                state.markFailure(e.getMessage(), true);
                log.warn("MCP handshake attempt failed: server={}, attempt={}/{}, error={}",
                        server.name(), attempt, backoff.maxAttempts(), e.getMessage());
            }
        }
        throw new McpConnectionException(server.name(),
                "Unavailable after " + backoff.maxAttempts() + " attempts: " + (last == null ? "" : last.getMessage()), last);
    }

    private void sleep(McpServerDefinition server, Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new McpConnectionException(server.name(), "Interrupted while waiting to reconnect", e);
        }
    }

    private Duration effectiveTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return Duration.ofMillis(mcpProperties.getDefaultTimeoutMs());
        }
        return timeout;
    }
}
