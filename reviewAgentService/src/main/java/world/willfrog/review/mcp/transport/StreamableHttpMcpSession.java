package world.willfrog.review.mcp.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import world.willfrog.review.mcp.McpConnectionException;
import world.willfrog.review.mcp.McpServerDefinition;
import world.willfrog.review.mcp.McpToolException;
import world.willfrog.review.mcp.ToolPayload;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MCP Streamable HTTP session。
 * <p>
 * 请求均为 POST {endpoint} 的 JSON-RPC 2.0 消息，响应可以是 application/json，
 * 也可以是 text/event-stream（按 data: 行拼接后匹配请求 id）。关闭时发送 DELETE 结束 session。
 */
@Slf4j
class StreamableHttpMcpSession implements McpSession {

    static final String SESSION_HEADER = "Mcp-Session-Id";
    static final String PROTOCOL_VERSION_HEADER = "MCP-Protocol-Version";
    static final String PROTOCOL_VERSION = "2025-03-26";
    private static final String CLIENT_NAME = "review-agent";
    private static final String CLIENT_VERSION = "1.0.0";
    private static final String EVENT_STREAM = "text/event-stream";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final McpServerDefinition server;
    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;
    private final RequestConfig requestConfig;
    private final AtomicInteger requestIds = new AtomicInteger();
    private String sessionId;
    private boolean initialized;

    StreamableHttpMcpSession(CloseableHttpClient httpClient,
                             ObjectMapper objectMapper,
                             McpServerDefinition server,
                             String apiKey,
                             Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.server = server;
        this.endpoint = server.endpoint();
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(Math.max(1, timeout.toMillis())))
                .build();
    }

    @Override
    public void initialize() {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("protocolVersion", PROTOCOL_VERSION);
        params.putObject("capabilities");
        params.putObject("clientInfo").put("name", CLIENT_NAME).put("version", CLIENT_VERSION);

        int id = requestIds.incrementAndGet();
        HttpExchange exchange = send(jsonRpcRequest(id, "initialize", params), "initialize");
        if (!exchange.isSuccess()) {
            throw new McpConnectionException(server.name(), "Handshake failed with HTTP " + exchange.status()
                    + " from " + endpoint + ": " + preview(exchange.body()));
        }
        if (exchange.sessionId() != null && !exchange.sessionId().isBlank()) {
            sessionId = exchange.sessionId();
        }
        JsonNode message = readMessage(exchange, id, "initialize");
        if (message == null) {
            throw new McpConnectionException(server.name(), "Empty initialize response from " + endpoint);
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            throw new McpConnectionException(server.name(), "Handshake rejected: " + error.path("message").asText("unknown"));
        }

        ObjectNode notification = objectMapper.createObjectNode();
        notification.put("jsonrpc", "2.0");
        notification.put("method", "notifications/initialized");
        HttpExchange ack = send(notification, "notifications/initialized");
        if (!ack.isSuccess()) {
            throw new McpConnectionException(server.name(), "Initialized notification rejected with HTTP " + ack.status());
        }
        initialized = true;
        log.debug("MCP session opened: server={}, sessionId={}", server.name(), sessionId);
    }

    @Override
    public List<String> listTools() {
        ensureInitialized();
        int id = requestIds.incrementAndGet();
        HttpExchange exchange = send(jsonRpcRequest(id, "tools/list", objectMapper.createObjectNode()), "tools/list");
        checkStatus(exchange, "tools/list");
        JsonNode message = readMessage(exchange, id, "tools/list");
        if (message == null) {
            return List.of();
        }
        throwIfRpcError(message, "tools/list");
        List<String> tools = new ArrayList<>();
        for (JsonNode tool : message.path("result").path("tools")) {
            String name = tool.path("name").asText("");
            if (!name.isBlank()) {
                tools.add(name);
            }
        }
        return tools;
    }

    @Override
    public ToolPayload callTool(String toolName, Map<String, Object> arguments) {
        ensureInitialized();
        ObjectNode params = objectMapper.createObjectNode();
        params.put("name", toolName);
        params.set("arguments", objectMapper.valueToTree(arguments == null ? Map.of() : arguments));

        int id = requestIds.incrementAndGet();
        HttpExchange exchange = send(jsonRpcRequest(id, "tools/call", params), toolName);
        checkStatus(exchange, toolName);
        JsonNode message = readMessage(exchange, id, toolName);
        if (message == null) {
            return ToolPayload.empty();
        }
        throwIfRpcError(message, toolName);
        JsonNode result = message.get("result");
        if (result == null || result.isNull()) {
            return ToolPayload.empty();
        }
        if (result.path("isError").asBoolean(false)) {
            String text = firstText(result.path("content"));
            throw new McpToolException(toolName, text == null || text.isBlank() ? "Tool reported an error" : text,
                    Map.of("server", server.name()));
        }
        return toPayload(result);
    }

    @Override
    public void close() {
        if (sessionId == null) {
            return;
        }
        HttpDelete delete = new HttpDelete(endpoint);
        applyHeaders(delete);
        try {
            httpClient.execute(delete, response -> {
                EntityUtils.consume(response.getEntity());
                return response.getCode();
            });
        } catch (IOException e) {
            log.debug("MCP session close failed: server={}, sessionId={}, error={}", server.name(), sessionId, e.getMessage());
        } finally {
            sessionId = null;
        }
    }

    private ToolPayload toPayload(JsonNode result) {
        JsonNode structured = result.get("structuredContent");
        if (structured != null && structured.isObject()) {
            return ToolPayload.structured(objectMapper.convertValue(structured, MAP_TYPE));
        }
        JsonNode content = result.isArray() ? result : result.get("content");
        if (content == null) {
            return ToolPayload.structured(objectMapper.convertValue(result, MAP_TYPE));
        }
        if (!content.isArray() || content.isEmpty()) {
            return ToolPayload.empty();
        }
        String text = firstText(content);
        if (text != null) {
            return ToolPayload.raw(text);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("content", objectMapper.convertValue(content, Object.class));
        return ToolPayload.structured(wrapped);
    }

    private String firstText(JsonNode content) {
        if (content == null || !content.isArray()) {
            return null;
        }
        for (JsonNode item : content) {
            if ("text".equals(item.path("type").asText()) && item.has("text")) {
                return item.path("text").asText();
            }
        }
        return null;
    }

    private void throwIfRpcError(JsonNode message, String label) {
        JsonNode error = message.get("error");
        if (error == null || error.isNull()) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("server", server.name());
        details.put("code", error.path("code").asInt());
        JsonNode data = error.get("data");
        if (data != null && !data.isNull()) {
            details.put("data", objectMapper.convertValue(data, Object.class));
        }
        throw new McpToolException(label, error.path("message").asText("Unknown error"), details);
    }

    private void checkStatus(HttpExchange exchange, String label) {
        if (exchange.isSuccess()) {
            return;
        }
        int status = exchange.status();
        if (status == 401 || status == 403 || (status == 404 && sessionId != null)) {
            throw new McpConnectionException(server.name(), "HTTP " + status + " from " + endpoint);
        }
        throw new McpToolException(label, "HTTP " + status,
                Map.of("server", server.name(), "response_body", preview(exchange.body())), status, null);
    }

    private JsonNode readMessage(HttpExchange exchange, int id, String label) {
        String body = exchange.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            if (exchange.contentType().toLowerCase().startsWith(EVENT_STREAM)) {
                JsonNode event = readEventStream(body, id);
                if (event == null) {
                    throw new McpToolException(label, "No response for request id " + id,
                            Map.of("server", server.name(), "response_body", preview(body)));
                }
                return event;
            }
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new McpToolException(label, "Malformed response: " + e.getOriginalMessage(),
                    Map.of("server", server.name(), "response_body", preview(body)), e);
        }
    }

    /**
     * @return 与请求 id 匹配的事件，没有匹配时为 null（通知等其他事件被忽略）
     */
    private JsonNode readEventStream(String body, int id) throws JsonProcessingException {
        StringBuilder data = new StringBuilder();
        for (String rawLine : body.split("\n", -1)) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            if (line.startsWith("data:")) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(5).stripLeading());
                continue;
            }
            if (line.isEmpty() && data.length() > 0) {
                JsonNode event = objectMapper.readTree(data.toString());
                data.setLength(0);
                if (event.path("id").asInt(-1) == id) {
                    return event;
                }
            }
        }
        if (data.length() > 0) {
            JsonNode event = objectMapper.readTree(data.toString());
            if (event.path("id").asInt(-1) == id) {
                return event;
            }
        }
        return null;
    }

    private ObjectNode jsonRpcRequest(int id, String method, JsonNode params) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", id);
        body.put("method", method);
        if (params != null) {
            body.set("params", params);
        }
        return body;
    }

    private HttpExchange send(JsonNode body, String label) {
        HttpPost post = new HttpPost(endpoint);
        applyHeaders(post);
        post.setHeader("Accept", "application/json, " + EVENT_STREAM);
        post.setEntity(new StringEntity(body.toString(), ContentType.APPLICATION_JSON));
        try {
            return httpClient.execute(post, response -> {
                HttpEntity entity = response.getEntity();
                String text = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
                String contentType = entity == null || entity.getContentType() == null ? "" : entity.getContentType();
                Header session = response.getFirstHeader(SESSION_HEADER);
                return new HttpExchange(response.getCode(), session == null ? null : session.getValue(), contentType, text);
            });
        } catch (ConnectTimeoutException | ConnectException e) {
            throw new McpConnectionException(server.name(), "Connection failed to " + endpoint + ": " + e.getMessage(), e);
        } catch (SocketTimeoutException e) {
            throw new McpToolException(label, "Timed out after " + timeout.toMillis() + "ms",
                    Map.of("server", server.name()), e);
        } catch (IOException e) {
            throw new McpConnectionException(server.name(), "Transport error: " + e.getMessage(), e);
        }
    }

    private void applyHeaders(HttpUriRequestBase request) {
        request.setConfig(requestConfig);
        if (apiKey != null && !apiKey.isBlank()) {
            request.setHeader("Authorization", "Bearer " + apiKey);
        }
        if (sessionId != null) {
            request.setHeader(SESSION_HEADER, sessionId);
            request.setHeader(PROTOCOL_VERSION_HEADER, PROTOCOL_VERSION);
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("MCP session not initialized: " + server.name());
        }
    }

    private String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 300 ? text : text.substring(0, 300) + "...";
    }

    private record HttpExchange(int status, String sessionId, String contentType, String body) {

        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
