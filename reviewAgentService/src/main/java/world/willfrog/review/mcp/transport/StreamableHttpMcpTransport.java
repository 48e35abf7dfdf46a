package world.willfrog.review.mcp.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.springframework.stereotype.Component;
import world.willfrog.review.config.McpProperties;
import world.willfrog.review.mcp.McpServerDefinition;

import java.time.Duration;

/**
 * 基于 Apache HttpClient 5 的 MCP Streamable HTTP 传输。
 */
@Component
@RequiredArgsConstructor
public class StreamableHttpMcpTransport implements McpTransport {

    private final CloseableHttpClient mcpHttpClient;
    private final ObjectMapper objectMapper;
    private final McpProperties mcpProperties;

    @Override
    public McpSession open(McpServerDefinition server, Duration timeout) {
        Duration effective = timeout == null || timeout.isZero() || timeout.isNegative()
                ? Duration.ofMillis(mcpProperties.getDefaultTimeoutMs())
                : timeout;
        return new StreamableHttpMcpSession(mcpHttpClient, objectMapper, server, mcpProperties.getApiKey(), effective);
    }
}
