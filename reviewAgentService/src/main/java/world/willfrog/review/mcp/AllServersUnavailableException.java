package world.willfrog.review.mcp;

import java.util.Map;

public class AllServersUnavailableException extends McpException {

    private final Map<String, String> failures;

    public AllServersUnavailableException(Map<String, String> failures) {
        super("All MCP servers unavailable: " + failures);
        this.failures = Map.copyOf(failures);
    }

    public Map<String, String> getFailures() {
        return failures;
    }
}
