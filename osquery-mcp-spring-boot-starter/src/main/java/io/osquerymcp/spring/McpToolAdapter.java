package io.osquerymcp.spring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.JsonSchema;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import io.osquerymcp.core.registry.ToolDescriptor;
import io.osquerymcp.core.tools.ToolDispatcher;
import io.osquerymcp.core.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Translates between registry descriptors / tool results and MCP schema types.
 *
 * <p>Shared by all transports so that stdio, SSE and stateless HTTP advertise the
 * same tools and render results identically.
 */
public class McpToolAdapter {

    private static final Logger log = LoggerFactory.getLogger(McpToolAdapter.class);

    private final ToolDispatcher dispatcher;
    private final ObjectMapper mcpObjectMapper;

    public McpToolAdapter(ToolDispatcher dispatcher, ObjectMapper mcpObjectMapper) {
        this.dispatcher = dispatcher;
        this.mcpObjectMapper = mcpObjectMapper;
    }

    public List<ToolDescriptor<?>> descriptors() {
        return dispatcher.getRegistry().list();
    }

    /**
     * Build the MCP tool definition for a descriptor.
     */
    public Tool toTool(ToolDescriptor<?> descriptor) {
        return Tool.builder()
            .name(descriptor.name())
            .description(descriptor.description())
            .inputSchema(createJsonSchema(descriptor.inputSchema()))
            .build();
    }

    /**
     * Run a tool call through the dispatcher and render the MCP result.
     */
    public CallToolResult call(String toolName, Map<String, Object> arguments) {
        log.debug("MCP tool call: {} with args: {}", toolName, arguments);
        return toCallToolResult(dispatcher.dispatch(toolName, arguments));
    }

    /**
     * Run a tool call on the dispatcher's executor.
     *
     * @return Future with the rendered result; completes exceptionally only on cancellation
     */
    public CompletableFuture<CallToolResult> callAsync(String toolName, Map<String, Object> arguments) {
        log.debug("MCP async tool call: {} with args: {}", toolName, arguments);
        return dispatcher.dispatchAsync(toolName, arguments).thenApply(this::toCallToolResult);
    }

    /**
     * Render a tool result as a single text content. Error payloads set {@code isError}.
     */
    public CallToolResult toCallToolResult(ToolResult result) {
        if (result.error()) {
            return new CallToolResult(List.of(new TextContent(result.errorPayload().text())), true);
        }
        return new CallToolResult(List.of(new TextContent(render(result.content()))), false);
    }

    String render(Object content) {
        if (content == null) {
            return "null";
        }
        if (content instanceof String) {
            return (String) content;
        }
        if (content instanceof JsonNode && ((JsonNode) content).isTextual()) {
            return ((JsonNode) content).asText();
        }
        try {
            return mcpObjectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize tool result of type {}: {}", content.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(content);
        }
    }

    @SuppressWarnings("unchecked")
    private JsonSchema createJsonSchema(Map<String, Object> schemaMap) {
        String type = (String) schemaMap.getOrDefault("type", "object");
        Map<String, Object> properties = (Map<String, Object>) schemaMap.get("properties");
        List<String> required = (List<String>) schemaMap.get("required");

        return new JsonSchema(
            type,
            properties,
            required,
            null,  // additionalProperties
            null,  // defs
            null   // definitions
        );
    }
}
