package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for GetNodesHotThreadsTool.
 */
public record NodesHotThreadsParams(
    @JsonProperty("node_id")
    @JsonPropertyDescription("A comma-separated list of node IDs or names. If not provided, hot threads for all nodes are returned.")
    String nodeId
) {}
