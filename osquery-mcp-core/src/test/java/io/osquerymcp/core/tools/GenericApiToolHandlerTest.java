package io.osquerymcp.core.tools;

import io.osquerymcp.core.args.GenericApiParams;
import io.osquerymcp.core.args.ToolArguments;
import io.osquerymcp.core.client.ApiRequest;
import io.osquerymcp.core.client.StubOpenSearchClient;
import io.osquerymcp.core.client.UpstreamCallException;
import io.osquerymcp.core.compat.CompatibilityGate;
import io.osquerymcp.core.registry.HttpVerb;
import io.osquerymcp.core.registry.ToolRegistry;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

class GenericApiToolHandlerTest {

    private StubOpenSearchClient client;
    private GenericApiToolHandler handler;

    @BeforeEach
    void setUp() {
        client = new StubOpenSearchClient();
        ToolRegistry registry = new ToolRegistry();
        CompatibilityGate gate = new CompatibilityGate(registry);
        OpenSearchToolCatalog.registerAll(registry, gate, client);
        handler = new GenericApiToolHandler(gate, client);
    }

    private static ToolArguments<GenericApiParams> args(String method, String path, Object body) {
        return ToolArguments.of(new GenericApiParams(method, path, Map.of("v", true), body, Map.of("X-Trace", "1")));
    }

    @Test
    @DisplayName("request is passed through with path normalised")
    void passthrough() {
        client.respond(HttpVerb.PUT, "/my-index", "{\"acknowledged\":true}");

        ToolResult result = handler.execute(args("put", "my-index", Map.of("settings", Map.of())));

        assertFalse(result.error());
        ApiRequest sent = client.capabilityRequests().get(0);
        assertEquals(HttpVerb.PUT, sent.method());
        assertEquals("/my-index", sent.path());
        assertEquals(true, sent.queryParams().get("v"));
        assertEquals("1", sent.headers().get("X-Trace"));
        assertTrue(sent.body().has("settings"));
    }

    @Test
    @DisplayName("string body is sent as text")
    void stringBody() {
        client.respond(HttpVerb.POST, "/_bulk", "{\"errors\":false}");

        handler.execute(args("POST", "/_bulk", "{\"index\":{}}\n{\"a\":1}\n"));

        assertTrue(client.capabilityRequests().get(0).body().isTextual());
    }

    @Test
    @DisplayName("incompatible cluster makes zero DELETE calls")
    void incompatibleDeleteNeverSent() {
        client.withVersion("0.7.0").respond(HttpVerb.DELETE, "/_index/test", "{\"acknowledged\":true}");

        ToolResult result = handler.execute(args("DELETE", "/_index/test", null));

        assertTrue(result.error());
        assertTrue(result.errorPayload().text().startsWith("Error calling OpenSearch API: Tool 'GenericOpenSearchApiTool'"));
        assertEquals(0, client.count(HttpVerb.DELETE));
    }

    @Test
    @DisplayName("upstream error is wrapped with the tool's prefix")
    void upstreamError() {
        client.fail(HttpVerb.GET, "/_nope", new UpstreamCallException("HTTP 404: no handler found", 404));

        ToolResult result = handler.execute(args("GET", "/_nope", null));

        assertEquals("Error calling OpenSearch API: HTTP 404: no handler found", result.errorPayload().text());
    }
}
