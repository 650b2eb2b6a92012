package io.osquerymcp.core.registry;

import io.osquerymcp.core.args.ArgumentModel;
import io.osquerymcp.core.args.ToolArguments;
import io.osquerymcp.core.tools.ToolHandler;
import io.osquerymcp.core.tools.ToolResult;
import io.osquerymcp.core.version.VersionRange;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Identity and metadata for one registered tool.
 *
 * @param name          Unique registry key (e.g., "ListIndexTool")
 * @param displayName   Name used in user-facing messages
 * @param description   Human-readable description advertised to MCP clients
 * @param argumentModel Typed argument contract, also the source of the input schema
 * @param handler       Handler that executes the tool
 * @param versionRange  Cluster versions the tool supports
 * @param httpMethods   Verbs the underlying call may use
 * @param <P>           Tool-specific parameter record
 */
public record ToolDescriptor<P>(
    String name,
    String displayName,
    String description,
    ArgumentModel<P> argumentModel,
    ToolHandler<P> handler,
    VersionRange versionRange,
    Set<HttpVerb> httpMethods
) {

    public ToolDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        Objects.requireNonNull(argumentModel, "argumentModel");
        Objects.requireNonNull(handler, "handler");
        if (httpMethods == null || httpMethods.isEmpty()) {
            throw new IllegalArgumentException("Tool " + name + " must declare at least one HTTP method");
        }
        displayName = displayName == null || displayName.isBlank() ? name : displayName;
        description = description != null ? description : "";
        versionRange = versionRange != null ? versionRange : VersionRange.unbounded();
        httpMethods = Collections.unmodifiableSet(EnumSet.copyOf(httpMethods));
    }

    /**
     * JSON Schema of the accepted arguments.
     *
     * @return Schema as a Map
     */
    public Map<String, Object> inputSchema() {
        return argumentModel.inputSchema();
    }

    /**
     * Validate raw arguments and run the handler.
     *
     * @param rawArguments Arguments as received from the caller
     * @return The handler's result
     * @throws io.osquerymcp.core.args.ArgumentValidationException if the arguments are malformed
     */
    public ToolResult invoke(Map<String, Object> rawArguments) {
        ToolArguments<P> arguments = argumentModel.bind(rawArguments);
        return handler.execute(arguments);
    }
}
