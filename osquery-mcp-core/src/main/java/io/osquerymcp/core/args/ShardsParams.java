package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for GetShardsTool.
 */
public record ShardsParams(
    @JsonProperty(value = "index", required = true)
    @JsonPropertyDescription("The name of the index to get shard information for")
    String index
) {}
