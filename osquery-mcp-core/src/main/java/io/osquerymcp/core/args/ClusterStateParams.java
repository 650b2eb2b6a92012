package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for GetClusterStateTool.
 */
public record ClusterStateParams(
    @JsonProperty("metric")
    @JsonPropertyDescription("Limit the information returned to the specified metrics. Options include: _all, blocks, metadata, nodes, routing_table, routing_nodes, master_node, version")
    String metric,

    @JsonProperty("index")
    @JsonPropertyDescription("Limit the information returned to the specified indices")
    String index
) {}
