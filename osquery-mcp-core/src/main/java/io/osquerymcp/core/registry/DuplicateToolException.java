package io.osquerymcp.core.registry;

import io.osquerymcp.core.OsQueryException;

/**
 * Thrown when a tool is registered under a name that is already taken.
 *
 * <p>This is a configuration defect; startup must not continue.
 */
public class DuplicateToolException extends OsQueryException {

    private final String toolName;

    public DuplicateToolException(String toolName) {
        super("Tool already registered: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
