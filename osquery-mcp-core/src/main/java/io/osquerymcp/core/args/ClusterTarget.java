package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Identifies which configured OpenSearch cluster a tool call targets.
 *
 * <p>Shared by every tool's arguments. A blank name selects the default cluster.
 *
 * @param clusterName Configured cluster name, or null for the default
 */
public record ClusterTarget(
    @JsonProperty(FIELD)
    @JsonPropertyDescription("Name of the configured OpenSearch cluster to query. Leave empty to use the default cluster.")
    String clusterName
) {

    public static final String FIELD = "opensearch_cluster_name";

    private static final ClusterTarget DEFAULT = new ClusterTarget(null);

    public ClusterTarget {
        clusterName = clusterName == null || clusterName.isBlank() ? null : clusterName.trim();
    }

    public static ClusterTarget defaultCluster() {
        return DEFAULT;
    }

    public static ClusterTarget named(String clusterName) {
        return new ClusterTarget(clusterName);
    }

    public boolean isDefault() {
        return clusterName == null;
    }

    @Override
    public String toString() {
        return isDefault() ? "<default>" : clusterName;
    }
}
