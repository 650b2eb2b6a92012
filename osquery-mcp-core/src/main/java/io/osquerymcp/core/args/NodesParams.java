package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for GetNodesTool.
 */
public record NodesParams(
    @JsonProperty("node_id")
    @JsonPropertyDescription("A comma-separated list of node IDs or names to limit the returned information. Supports node filters like _local, _master, master:true.")
    String nodeId,

    @JsonProperty("metric")
    @JsonPropertyDescription("A comma-separated list of metric groups to include, e.g. settings, os, process, jvm, thread_pool, transport, http, plugins, ingest")
    String metric
) {}
