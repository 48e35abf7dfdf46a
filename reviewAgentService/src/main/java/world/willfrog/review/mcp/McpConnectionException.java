package world.willfrog.review.mcp;

/**
 * server 不可达、握手失败或 session 失效。
 */
public class McpConnectionException extends McpException {

    private final String serverName;

    public McpConnectionException(String serverName, String message) {
        super(serverName + ": " + message);
        this.serverName = serverName;
    }

    public McpConnectionException(String serverName, String message, Throwable cause) {
        super(serverName + ": " + message, cause);
        this.serverName = serverName;
    }

    public String getServerName() {
        return serverName;
    }
}
