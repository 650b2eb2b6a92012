package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for GetAllocationTool.
 */
public record AllocationParams(
    @JsonProperty("node_id")
    @JsonPropertyDescription("A comma-separated list of node IDs or names to limit the returned information")
    String nodeId
) {}
