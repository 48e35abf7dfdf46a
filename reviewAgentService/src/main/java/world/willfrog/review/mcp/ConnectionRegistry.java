package world.willfrog.review.mcp;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import world.willfrog.review.config.McpProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 已配置 MCP server 的注册表。
 * <p>
 * 职责：
 * 1. 持有 server 定义与对应的 {@link ServerConnectionState}；
 * 2. 按工具名解析目标 server，未映射的工具直接失败。
 */
@Component
public class ConnectionRegistry {

    private final Map<String, McpServerDefinition> servers;
    private final Map<String, ServerConnectionState> states;
    private final ToolRouting routing;

    @Autowired
    public ConnectionRegistry(McpProperties mcpProperties) {
        this(toDefinitions(mcpProperties));
    }

    public ConnectionRegistry(List<McpServerDefinition> definitions) {
        Map<String, McpServerDefinition> serverMap = new LinkedHashMap<>();
        Map<String, ServerConnectionState> stateMap = new LinkedHashMap<>();
        for (McpServerDefinition definition : definitions) {
            if (serverMap.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalStateException("Duplicate MCP server: " + definition.name());
            }
            stateMap.put(definition.name(), new ServerConnectionState(definition.name()));
        }
        this.servers = serverMap;
        this.states = stateMap;
        this.routing = ToolRouting.of(serverMap.values());
    }

    public McpServerDefinition resolve(String toolName) {
        String serverName = routing.serverFor(toolName).orElseThrow(() -> new UnknownToolException(toolName));
        return servers.get(serverName);
    }

    public McpServerDefinition server(String serverName) {
        return servers.get(serverName);
    }

    public ServerConnectionState state(String serverName) {
        return states.get(serverName);
    }

    public List<McpServerDefinition> servers() {
        return List.copyOf(servers.values());
    }

    public Map<String, ServerConnectionState.Snapshot> snapshots() {
        Map<String, ServerConnectionState.Snapshot> result = new LinkedHashMap<>();
        states.forEach((name, state) -> result.put(name, state.snapshot()));
        return result;
    }

    /**
     * 当前已连接 server 上的工具。已做过工具发现的 server 以发现结果为准，否则用配置的工具表。
     */
    public Set<String> availableTools() {
        Set<String> tools = new LinkedHashSet<>();
        for (McpServerDefinition server : servers.values()) {
            ServerConnectionState state = states.get(server.name());
            if (!state.isConnected()) {
                continue;
            }
            Set<String> discovered = state.getAvailableTools();
            tools.addAll(discovered.isEmpty() ? server.tools() : discovered);
        }
        return tools;
    }

    private static List<McpServerDefinition> toDefinitions(McpProperties properties) {
        List<McpServerDefinition> definitions = new ArrayList<>();
        properties.getServers().forEach((name, server) -> definitions.add(new McpServerDefinition(
                name, server.getBaseUrl(), properties.getEndpointPath(), server.getTools())));
        return definitions;
    }
}
