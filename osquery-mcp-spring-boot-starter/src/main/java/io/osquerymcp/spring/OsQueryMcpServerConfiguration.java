package io.osquerymcp.spring;

import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpAsyncServer;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.server.McpStatelessSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletSseServerTransportProvider;
import io.modelcontextprotocol.server.transport.HttpServletStatelessServerTransport;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.osquerymcp.core.OsQueryObjectMappers;
import io.osquerymcp.core.registry.ToolDescriptor;
import jakarta.servlet.http.HttpServlet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * MCP server wiring, one nested configuration per {@code osquery.transport}.
 *
 * <ul>
 *   <li>{@code http} (default) - stateless JSON-RPC over POST at {@code osquery.endpoint}</li>
 *   <li>{@code sse} - server-sent events at {@code osquery.sse-endpoint}, messages
 *       posted to {@code osquery.message-endpoint}</li>
 *   <li>{@code stdio} - JSON-RPC over stdin/stdout, no web server</li>
 * </ul>
 * Every transport advertises the same tools through {@link McpToolAdapter}. Tools are
 * handed to the server builder, so no {@code tools/list_changed} notification is sent
 * at startup. The session transports (SSE, stdio) run calls on the tool executor via
 * {@link McpToolAdapter#callAsync}; stateless HTTP runs them on the servlet thread.
 */
@Configuration
public class OsQueryMcpServerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OsQueryMcpServerConfiguration.class);

    static final String TRANSPORT_PROPERTY = "osquery.transport";

    // MCP SDK uses Jackson 2 (com.fasterxml.jackson)
    static JacksonMcpJsonMapper mcpJsonMapper() {
        return new JacksonMcpJsonMapper(OsQueryObjectMappers.create());
    }

    static ServerCapabilities capabilities() {
        return ServerCapabilities.builder()
            .tools(true)
            .build();
    }

    @Configuration
    @ConditionalOnProperty(name = TRANSPORT_PROPERTY, havingValue = "http", matchIfMissing = true)
    static class StatelessHttpTransportConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public HttpServletStatelessServerTransport mcpStatelessTransport(OsQueryProperties properties) {
            return HttpServletStatelessServerTransport.builder()
                .jsonMapper(mcpJsonMapper())
                .messageEndpoint(properties.getEndpoint())
                .build();
        }

        @Bean
        @ConditionalOnMissingBean
        public McpStatelessSyncServer mcpStatelessServer(
                HttpServletStatelessServerTransport transport,
                McpToolAdapter adapter,
                OsQueryProperties properties) {

            McpStatelessSyncServer server = McpServer.sync(transport)
                .serverInfo(properties.advertisedName(), properties.getServer().getVersion())
                .capabilities(capabilities())
                .tools(statelessToolSpecifications(adapter))
                .build();

            log.info("Stateless MCP server '{}' initialized with {} tools",
                properties.advertisedName(), adapter.descriptors().size());
            return server;
        }

        @Bean
        @ConditionalOnMissingBean(name = "mcpServletRegistration")
        public ServletRegistrationBean<HttpServlet> mcpServletRegistration(
                HttpServletStatelessServerTransport transport,
                OsQueryProperties properties) {

            ServletRegistrationBean<HttpServlet> registration =
                new ServletRegistrationBean<>(transport, properties.getEndpoint());
            registration.setName("mcpServlet");
            registration.setLoadOnStartup(1);

            log.info("Registered stateless MCP servlet at {}", properties.getEndpoint());
            return registration;
        }
    }

    @Configuration
    @ConditionalOnProperty(name = TRANSPORT_PROPERTY, havingValue = "sse")
    static class SseTransportConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public HttpServletSseServerTransportProvider mcpSseTransport(OsQueryProperties properties) {
            return HttpServletSseServerTransportProvider.builder()
                .jsonMapper(mcpJsonMapper())
                .sseEndpoint(properties.getSseEndpoint())
                .messageEndpoint(properties.getMessageEndpoint())
                .build();
        }

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean
        public McpAsyncServer mcpSseServer(
                HttpServletSseServerTransportProvider transport,
                McpToolAdapter adapter,
                OsQueryProperties properties) {
            McpAsyncServer server = McpServer.async(transport)
                .serverInfo(properties.advertisedName(), properties.getServer().getVersion())
                .capabilities(capabilities())
                .tools(toolSpecifications(adapter))
                .build();
            log.info("SSE MCP server '{}' initialized with {} tools",
                properties.advertisedName(), adapter.descriptors().size());
            return server;
        }

        @Bean
        @ConditionalOnMissingBean(name = "mcpServletRegistration")
        public ServletRegistrationBean<HttpServlet> mcpServletRegistration(
                HttpServletSseServerTransportProvider transport,
                OsQueryProperties properties) {

            ServletRegistrationBean<HttpServlet> registration = new ServletRegistrationBean<>(
                transport, properties.getSseEndpoint(), properties.getMessageEndpoint());
            registration.setName("mcpSseServlet");
            registration.setLoadOnStartup(1);
            registration.setAsyncSupported(true);

            log.info("Registered SSE MCP servlet at {} (messages: {})",
                properties.getSseEndpoint(), properties.getMessageEndpoint());
            return registration;
        }
    }

    @Configuration
    @ConditionalOnProperty(name = TRANSPORT_PROPERTY, havingValue = "stdio")
    static class StdioTransportConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public StdioServerTransportProvider mcpStdioTransport() {
            return new StdioServerTransportProvider(mcpJsonMapper());
        }

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean
        public McpAsyncServer mcpStdioServer(
                StdioServerTransportProvider transport,
                McpToolAdapter adapter,
                OsQueryProperties properties) {
            McpAsyncServer server = McpServer.async(transport)
                .serverInfo(properties.advertisedName(), properties.getServer().getVersion())
                .capabilities(capabilities())
                .tools(toolSpecifications(adapter))
                .build();
            log.info("Stdio MCP server '{}' initialized with {} tools",
                properties.advertisedName(), adapter.descriptors().size());
            return server;
        }
    }

    static List<McpStatelessServerFeatures.SyncToolSpecification> statelessToolSpecifications(McpToolAdapter adapter) {
        List<McpStatelessServerFeatures.SyncToolSpecification> specifications = new ArrayList<>();
        for (ToolDescriptor<?> descriptor : adapter.descriptors()) {
            specifications.add(new McpStatelessServerFeatures.SyncToolSpecification(
                adapter.toTool(descriptor),
                (context, request) -> adapter.call(request.name(), request.arguments())));
        }
        return specifications;
    }

    static List<McpServerFeatures.AsyncToolSpecification> toolSpecifications(McpToolAdapter adapter) {
        List<McpServerFeatures.AsyncToolSpecification> specifications = new ArrayList<>();
        for (ToolDescriptor<?> descriptor : adapter.descriptors()) {
            specifications.add(McpServerFeatures.AsyncToolSpecification.builder()
                .tool(adapter.toTool(descriptor))
                .callHandler((exchange, request) ->
                    Mono.<CallToolResult>fromFuture(() -> adapter.callAsync(request.name(), request.arguments())))
                .build());
        }
        return specifications;
    }
}
