package world.willfrog.review.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class McpClientConfig {

    /**
     * MCP 调用使用的 HTTP 客户端。
     * <p>
     * 每次调用都是独立 session，底层连接不复用，也不做自动重试（重试由 ToolInvoker 的退避控制）。
     */
    @Bean(destroyMethod = "close")
    public CloseableHttpClient mcpHttpClient(McpProperties mcpProperties) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(Math.max(1, mcpProperties.getConnectTimeoutMs())))
                .build();
        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setConnectionReuseStrategy((request, response, context) -> false)
                .disableAutomaticRetries()
                .build();
    }
}
