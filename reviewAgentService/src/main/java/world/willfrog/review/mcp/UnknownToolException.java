package world.willfrog.review.mcp;

/**
 * 工具名不属于任何已配置的 server。属于调用方编程错误，不重试。
 */
public class UnknownToolException extends McpException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
