package world.willfrog.review.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP 工具服务器连接配置。
 * <p>
 * 每个 server 声明自己的 baseUrl 与所拥有的工具名，工具名在所有 server 之间必须唯一。
 *
 * @see world.willfrog.review.mcp.ConnectionRegistry
 */
@Data
@ConfigurationProperties(prefix = "review.mcp")
public class McpProperties {

    /**
     * 可选 Bearer 凭证，配置后附加到每个请求。
     */
    private String apiKey;

    /**
     * Streamable HTTP 端点路径。
     */
    private String endpointPath = "/mcp";

    /**
     * 建立 TCP 连接的超时（毫秒）。
     */
    private long connectTimeoutMs = 5000;

    /**
     * 未指定超时的工具调用默认超时（毫秒）。
     */
    private long defaultTimeoutMs = 60000;

    /**
     * 启动时是否对全部 server 做握手与工具发现。
     */
    private boolean initializeOnStartup = true;

    /**
     * 重连退避配置。
     */
    private Retry retry = new Retry();

    /**
     * server 名称 -> server 配置，保持声明顺序。
     */
    private Map<String, Server> servers = new LinkedHashMap<>();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 8000;
        private double multiplier = 2.0;
    }

    @Data
    public static class Server {
        private String baseUrl;
        private List<String> tools = new ArrayList<>();
    }
}
