package io.osquerymcp.core.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.osquerymcp.core.client.StubOpenSearchClient;
import io.osquerymcp.core.compat.CompatibilityGate;
import io.osquerymcp.core.registry.DuplicateToolException;
import io.osquerymcp.core.registry.HttpVerb;
import io.osquerymcp.core.registry.ToolDescriptor;
import io.osquerymcp.core.registry.ToolRegistry;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

class OpenSearchToolCatalogTest {

    private StubOpenSearchClient client;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        client = new StubOpenSearchClient();
        registry = OpenSearchToolCatalog.createRegistry(client);
    }

    @Test
    @DisplayName("registers the fifteen built-in tools in a stable order")
    void allTools() {
        List<String> names = registry.list().stream().map(ToolDescriptor::name).collect(Collectors.toList());
        assertEquals(15, names.size());
        assertEquals(OpenSearchToolCatalog.LIST_INDICES, names.get(0));
        assertEquals(OpenSearchToolCatalog.GENERIC_API, names.get(7));
        assertEquals(OpenSearchToolCatalog.LONG_RUNNING_TASKS, names.get(14));
    }

    @Test
    @DisplayName("every listed tool is found under its own name")
    void lookupByOwnName() {
        for (ToolDescriptor<?> descriptor : registry.list()) {
            assertEquals(descriptor.name(), registry.get(descriptor.name()).name());
        }
    }

    @Test
    @DisplayName("version ranges and verbs match each tool's capability")
    void metadata() {
        assertTrue(registry.get(OpenSearchToolCatalog.INDEX_MAPPING).versionRange().isUnbounded());
        assertEquals("2.12.0", registry.get(OpenSearchToolCatalog.QUERY_INSIGHTS).versionRange().min());
        assertEquals("1.0.0", registry.get(OpenSearchToolCatalog.SHARDS).versionRange().min());
        assertEquals(HttpVerb.all(), registry.get(OpenSearchToolCatalog.GENERIC_API).httpMethods());
        assertEquals(HttpVerb.of(HttpVerb.GET, HttpVerb.POST),
            registry.get(OpenSearchToolCatalog.SEARCH_INDEX).httpMethods());
    }

    @Test
    @DisplayName("registering twice fails on the first duplicate")
    void registerTwice() {
        assertThrows(DuplicateToolException.class,
            () -> OpenSearchToolCatalog.registerAll(registry, new CompatibilityGate(registry), client));
        assertEquals(15, registry.size());
    }

    @Nested
    @DisplayName("capability calls")
    class CapabilityTests {

        private ToolDispatcher dispatcher;

        @BeforeEach
        void setUpDispatcher() {
            dispatcher = new ToolDispatcher(registry, Runnable::run);
        }

        @Test
        @DisplayName("cluster state with index but no metric uses _all")
        void clusterStateIndexOnly() {
            client.respond(HttpVerb.GET, "/_cluster/state/_all/logs", "{}");
            assertFalse(dispatcher.dispatch(OpenSearchToolCatalog.CLUSTER_STATE, Map.of("index", "logs")).error());
        }

        @Test
        @DisplayName("index stats failure uses its own prefix")
        void indexStatsPrefix() {
            ToolResult result = dispatcher.dispatch(OpenSearchToolCatalog.INDEX_STATS, Map.of("index", "gone"));
            assertTrue(result.errorPayload().text().startsWith("Error getting index statistics: "));
        }

        @Test
        @DisplayName("long-running tasks are truncated to the limit")
        void longRunningTasksLimit() {
            client.respond(HttpVerb.GET, "/_cat/tasks", "[{\"action\":\"a\"},{\"action\":\"b\"},{\"action\":\"c\"}]");

            ToolResult result = dispatcher.dispatch(OpenSearchToolCatalog.LONG_RUNNING_TASKS, Map.of("limit", 2));

            assertEquals(2, ((JsonNode) result.content()).size());
            assertEquals("running_time:desc", client.capabilityRequests().get(0).queryParams().get("s"));
        }

        @Test
        @DisplayName("hot threads for one node")
        void hotThreads() {
            client.respond(HttpVerb.GET, "/_nodes/n1/hot_threads", "\"::: {n1}\"");
            assertFalse(dispatcher.dispatch(OpenSearchToolCatalog.NODES_HOT_THREADS, Map.of("node_id", "n1")).error());
        }

        @Test
        @DisplayName("cat nodes passes the requested columns")
        void catNodesColumns() {
            client.respond(HttpVerb.GET, "/_cat/nodes", "[]");
            dispatcher.dispatch(OpenSearchToolCatalog.CAT_NODES, Map.of("metrics", "name,cpu"));
            assertEquals("name,cpu", client.capabilityRequests().get(0).queryParams().get("h"));
        }
    }
}
