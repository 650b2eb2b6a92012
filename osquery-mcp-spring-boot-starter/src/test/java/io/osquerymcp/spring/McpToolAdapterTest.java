package io.osquerymcp.spring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import io.osquerymcp.core.args.ClusterTarget;
import io.osquerymcp.core.client.ApiRequest;
import io.osquerymcp.core.client.RestOpenSearchClient;
import io.osquerymcp.core.registry.ToolRegistry;
import io.osquerymcp.core.tools.OpenSearchToolCatalog;
import io.osquerymcp.core.tools.ToolDispatcher;
import io.osquerymcp.core.tools.ToolResult;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

class McpToolAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private McpToolAdapter adapter;

    /**
     * Answers the cluster version request with 2.11.0 and every other request with an empty listing.
     */
    private static class FixedVersionClient extends RestOpenSearchClient {
        @Override
        public JsonNode execute(ClusterTarget target, ApiRequest request) {
            try {
                return "/".equals(request.path())
                    ? MAPPER.readTree("{\"version\":{\"number\":\"2.11.0\"}}")
                    : MAPPER.readTree("[{\"index\":\"logs\"}]");
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
    }

    @BeforeEach
    void setUp() {
        ToolRegistry registry = OpenSearchToolCatalog.createRegistry(new FixedVersionClient());
        adapter = new McpToolAdapter(new ToolDispatcher(registry, Runnable::run), MAPPER);
    }

    private static String text(CallToolResult result) {
        return ((TextContent) result.content().get(0)).text();
    }

    @Test
    @DisplayName("tool definition carries name, description and schema")
    void toTool() {
        Tool tool = adapter.toTool(adapter.descriptors().get(0));

        assertEquals(OpenSearchToolCatalog.LIST_INDICES, tool.name());
        assertTrue(tool.description().startsWith("Lists indices"));
        assertEquals("object", tool.inputSchema().type());
        assertTrue(tool.inputSchema().properties().containsKey(ClusterTarget.FIELD));
    }

    @Test
    @DisplayName("successful call renders JSON text")
    void successfulCall() {
        CallToolResult result = adapter.call(OpenSearchToolCatalog.LIST_INDICES, Map.of());

        assertFalse(result.isError());
        assertEquals("[\"logs\"]", text(result));
    }

    @Test
    @DisplayName("error payload maps to isError with the message as text")
    void errorCall() {
        CallToolResult result = adapter.call(OpenSearchToolCatalog.QUERY_INSIGHTS, Map.of());

        assertTrue(result.isError());
        assertTrue(text(result).contains("2.12.0 or later"));
    }

    @Test
    @DisplayName("text results are not re-quoted")
    void textResult() {
        CallToolResult result = adapter.toCallToolResult(ToolResult.success(TextNode.valueOf("::: hot threads")));
        assertEquals("::: hot threads", text(result));
    }

    @Test
    @DisplayName("async calls go through the dispatcher's executor")
    void asyncCall() throws Exception {
        AtomicInteger submitted = new AtomicInteger();
        Executor counting = task -> {
            submitted.incrementAndGet();
            task.run();
        };
        McpToolAdapter async = new McpToolAdapter(
            new ToolDispatcher(OpenSearchToolCatalog.createRegistry(new FixedVersionClient()), counting), MAPPER);

        CallToolResult result = async.callAsync(OpenSearchToolCatalog.LIST_INDICES, Map.of()).get(5, TimeUnit.SECONDS);

        assertEquals(1, submitted.get());
        assertEquals("[\"logs\"]", text(result));
    }
}
