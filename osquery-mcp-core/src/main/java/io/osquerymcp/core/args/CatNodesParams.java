package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for CatNodesTool.
 */
public record CatNodesParams(
    @JsonProperty("metrics")
    @JsonPropertyDescription("A comma-separated list of columns to display, e.g. name,heap.percent,cpu,load_1m. If not provided, the default columns are returned.")
    String metrics
) {}
