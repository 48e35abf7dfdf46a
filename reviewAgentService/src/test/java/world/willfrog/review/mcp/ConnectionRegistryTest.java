package world.willfrog.review.mcp;

import org.junit.jupiter.api.Test;
import world.willfrog.review.config.McpProperties;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionRegistryTest {

    @Test
    void constructor_shouldBuildRoutingFromProperties() {
        McpProperties properties = new McpProperties();
        McpProperties.Server store = new McpProperties.Server();
        store.setBaseUrl("http://document-store:3002/");
        store.setTools(List.of("ingest_document", "search_application_docs"));
        properties.getServers().put("document-store", store);

        ConnectionRegistry registry = new ConnectionRegistry(properties);

        McpServerDefinition server = registry.resolve("search_application_docs");
        assertEquals("document-store", server.name());
        assertEquals("http://document-store:3002/mcp", server.endpoint().toString());
        assertFalse(registry.state("document-store").isConnected());
        assertTrue(registry.availableTools().isEmpty());
    }

    @Test
    void constructor_shouldRejectToolOwnedByTwoServers() {
        List<McpServerDefinition> servers = List.of(
                new McpServerDefinition("a", "http://a", "/mcp", List.of("search_policy")),
                new McpServerDefinition("b", "http://b", "/mcp", List.of("search_policy")));

        assertThrows(IllegalStateException.class, () -> new ConnectionRegistry(servers));
    }

    @Test
    void resolve_shouldRejectUnmappedTool() {
        ConnectionRegistry registry = new ConnectionRegistry(List.of(
                new McpServerDefinition("a", "http://a", "/mcp", List.of("search_policy"))));

        assertThrows(UnknownToolException.class, () -> registry.resolve("get_policy_section"));
    }
}
