package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for IndexMappingTool.
 */
public record IndexMappingParams(
    @JsonProperty(value = "index", required = true)
    @JsonPropertyDescription("The name of the index to retrieve mappings for")
    String index
) {}
