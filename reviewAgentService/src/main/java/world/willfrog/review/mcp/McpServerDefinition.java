package world.willfrog.review.mcp;

import java.net.URI;
import java.util.List;

/**
 * 一个 MCP server 的静态定义。
 *
 * @param name         server 名称
 * @param baseUrl      基础地址，例如 http://policy-kb:3003
 * @param endpointPath Streamable HTTP 端点路径
 * @param tools        该 server 拥有的工具名
 */
public record McpServerDefinition(String name, String baseUrl, String endpointPath, List<String> tools) {

    public McpServerDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("server name must not be blank");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank for server " + name);
        }
        endpointPath = endpointPath == null || endpointPath.isBlank() ? "/mcp" : endpointPath;
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public URI endpoint() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = endpointPath.startsWith("/") ? endpointPath : "/" + endpointPath;
        return URI.create(base + path);
    }
}
