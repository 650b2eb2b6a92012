package io.osquerymcp.core.client;

import io.osquerymcp.core.args.ClusterTarget;

/**
 * Maps the cluster named in a tool call to its connection details.
 */
public interface ClusterConnectionResolver {

    /**
     * @param target Cluster target from the tool arguments
     * @return Connection details
     * @throws UnknownClusterException if the named cluster is not configured
     */
    ClusterConnection resolve(ClusterTarget target);
}
