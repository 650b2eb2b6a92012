package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for GetIndexInfoTool.
 */
public record IndexInfoParams(
    @JsonProperty(value = "index", required = true)
    @JsonPropertyDescription("The name of the index to get detailed information for. Wildcards are supported.")
    String index
) {}
