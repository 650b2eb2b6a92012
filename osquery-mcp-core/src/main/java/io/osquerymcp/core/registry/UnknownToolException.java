package io.osquerymcp.core.registry;

import io.osquerymcp.core.OsQueryException;

/**
 * Thrown when a tool name is not present in the registry.
 */
public class UnknownToolException extends OsQueryException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
