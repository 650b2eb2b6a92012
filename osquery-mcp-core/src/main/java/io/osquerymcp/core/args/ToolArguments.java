package io.osquerymcp.core.args;

/**
 * Validated arguments for one tool call: the shared cluster target plus the
 * tool-specific parameters.
 *
 * @param cluster Target cluster
 * @param params  Tool-specific parameter record
 * @param <P>     Parameter record type
 */
public record ToolArguments<P>(ClusterTarget cluster, P params) {

    public ToolArguments {
        cluster = cluster != null ? cluster : ClusterTarget.defaultCluster();
    }

    public static <P> ToolArguments<P> of(P params) {
        return new ToolArguments<>(ClusterTarget.defaultCluster(), params);
    }
}
