package io.osquerymcp.spring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpAsyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.osquerymcp.core.args.ClusterTarget;
import io.osquerymcp.core.client.ApiRequest;
import io.osquerymcp.core.client.RestOpenSearchClient;
import io.osquerymcp.core.tools.OpenSearchToolCatalog;
import io.osquerymcp.core.tools.ToolDispatcher;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the stdio server over in-memory pipes, the way an MCP client that spawned
 * the process would.
 */
class StdioTransportTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AtomicInteger toolTasks = new AtomicInteger();
    private final ExecutorService toolExecutor = Executors.newFixedThreadPool(2);
    private final ExecutorService clientReader = Executors.newSingleThreadExecutor();

    private PipedOutputStream toServer;
    private BufferedReader fromServer;
    private McpAsyncServer server;

    private static class FixedVersionClient extends RestOpenSearchClient {
        @Override
        public JsonNode execute(ClusterTarget target, ApiRequest request) {
            try {
                return "/".equals(request.path())
                    ? MAPPER.readTree("{\"version\":{\"number\":\"2.19.0\"}}")
                    : MAPPER.readTree("[{\"index\":\"logs\"}]");
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }

    @BeforeEach
    void startServer() throws IOException {
        PipedInputStream serverIn = new PipedInputStream(64 * 1024);
        toServer = new PipedOutputStream(serverIn);
        PipedInputStream clientIn = new PipedInputStream(256 * 1024);
        PipedOutputStream serverOut = new PipedOutputStream(clientIn);
        fromServer = new BufferedReader(new InputStreamReader(clientIn, StandardCharsets.UTF_8));

        ToolDispatcher dispatcher = new ToolDispatcher(
            OpenSearchToolCatalog.createRegistry(new FixedVersionClient()),
            task -> {
                toolTasks.incrementAndGet();
                toolExecutor.execute(task);
            });
        McpToolAdapter adapter = new McpToolAdapter(dispatcher, MAPPER);

        StdioServerTransportProvider transport = new StdioServerTransportProvider(
            OsQueryMcpServerConfiguration.mcpJsonMapper(), serverIn, serverOut);
        server = new OsQueryMcpServerConfiguration.StdioTransportConfiguration()
            .mcpStdioServer(transport, adapter, new OsQueryProperties());
    }

    @AfterEach
    void stopServer() throws IOException {
        server.close();
        toServer.close();
        clientReader.shutdownNow();
        toolExecutor.shutdownNow();
    }

    private void send(String json) throws IOException {
        toServer.write((json + "\n").getBytes(StandardCharsets.UTF_8));
        toServer.flush();
    }

    private JsonNode receive() throws Exception {
        String line = clientReader.submit(fromServer::readLine).get(10, TimeUnit.SECONDS);
        assertNotNull(line, "server closed its output");
        return MAPPER.readTree(line);
    }

    private void initialize() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{"
            + "\"protocolVersion\":\"2024-11-05\",\"capabilities\":{},"
            + "\"clientInfo\":{\"name\":\"stdio-test\",\"version\":\"1.0\"}}}");
        JsonNode response = receive();
        assertEquals(1, response.path("id").asInt(), "first line must answer initialize: " + response);
        assertTrue(response.has("result"));
        send("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");
    }

    @Test
    @DisplayName("nothing but the initialize response precedes the handshake")
    void noUnsolicitedOutput() throws Exception {
        initialize();

        send("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\",\"params\":{}}");
        JsonNode response = receive();

        assertEquals(2, response.path("id").asInt(), "unexpected message: " + response);
        assertEquals(15, response.path("result").path("tools").size());
    }

    @Test
    @DisplayName("tool calls run on the tool executor")
    void toolCallUsesExecutor() throws Exception {
        initialize();

        send("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{"
            + "\"name\":\"" + OpenSearchToolCatalog.LIST_INDICES + "\",\"arguments\":{}}}");
        JsonNode response = receive();

        assertEquals(3, response.path("id").asInt(), "unexpected message: " + response);
        JsonNode result = response.path("result");
        assertFalse(result.path("isError").asBoolean());
        assertEquals("[\"logs\"]", result.path("content").get(0).path("text").asText());
        assertEquals(1, toolTasks.get());
    }
}
