package world.willfrog.review.mcp;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 工具名到 server 名的静态映射，每个工具恰好属于一个 server。
 */
public final class ToolRouting {

    private final Map<String, String> toolToServer;

    private ToolRouting(Map<String, String> toolToServer) {
        this.toolToServer = toolToServer;
    }

    public static ToolRouting of(Collection<McpServerDefinition> servers) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (McpServerDefinition server : servers) {
            for (String tool : server.tools()) {
                String previous = mapping.putIfAbsent(tool, server.name());
                if (previous != null && !previous.equals(server.name())) {
                    throw new IllegalStateException("Tool " + tool + " is routed to both "
                            + previous + " and " + server.name());
                }
            }
        }
        return new ToolRouting(Map.copyOf(mapping));
    }

    public Optional<String> serverFor(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(toolToServer.get(toolName));
    }

    public Set<String> tools() {
        return toolToServer.keySet();
    }
}
