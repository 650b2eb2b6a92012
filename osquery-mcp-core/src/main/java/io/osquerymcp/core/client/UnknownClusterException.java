package io.osquerymcp.core.client;

import io.osquerymcp.core.OsQueryException;

/**
 * Thrown when a tool call names a cluster that is not configured.
 */
public class UnknownClusterException extends OsQueryException {

    private final String clusterName;

    public UnknownClusterException(String clusterName) {
        super("No OpenSearch cluster configured with name '" + clusterName + "'");
        this.clusterName = clusterName;
    }

    public String getClusterName() {
        return clusterName;
    }
}
