package io.osquerymcp.core.compat;

import io.osquerymcp.core.registry.ToolDescriptor;
import io.osquerymcp.core.registry.ToolRegistry;
import io.osquerymcp.core.version.VersionParseException;
import io.osquerymcp.core.version.VersionRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a tool may run against a cluster of a given version.
 *
 * <p>Must be consulted before a handler makes its capability call.
 */
public class CompatibilityGate {

    private static final Logger log = LoggerFactory.getLogger(CompatibilityGate.class);

    private final ToolRegistry registry;

    public CompatibilityGate(ToolRegistry registry) {
        this.registry = registry;
    }

    /**
     * Check a tool against the cluster's reported version.
     *
     * <p>An unparseable cluster version is treated as incompatible.
     *
     * @param toolName       Registered tool name
     * @param clusterVersion Version reported by the cluster
     * @return ok, or a rejection carrying the user-facing message
     * @throws io.osquerymcp.core.registry.UnknownToolException if the tool is not registered
     */
    public CompatibilityResult check(String toolName, String clusterVersion) {
        ToolDescriptor<?> descriptor = registry.get(toolName);
        VersionRange range = descriptor.versionRange();
        if (range.isUnbounded()) {
            return CompatibilityResult.ok();
        }

        boolean compatible;
        try {
            compatible = range.contains(clusterVersion);
        } catch (VersionParseException e) {
            log.warn("Cannot check {} against cluster version: {}", toolName, e.getMessage());
            compatible = false;
        }
        if (compatible) {
            return CompatibilityResult.ok();
        }

        String message = rejectionMessage(descriptor.displayName(), clusterVersion, range);
        log.debug("Rejected {}: {}", toolName, message);
        return CompatibilityResult.rejected(message);
    }

    static String rejectionMessage(String displayName, String clusterVersion, VersionRange range) {
        StringBuilder message = new StringBuilder()
            .append("Tool '").append(displayName)
            .append("' is not supported for this OpenSearch version (current version: ")
            .append(clusterVersion).append(").");
        String supported = range.describe();
        if (supported != null) {
            message.append(" Supported version: ").append(supported).append('.');
        }
        return message.toString();
    }
}
