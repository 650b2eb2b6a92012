package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for GetSegmentsTool.
 */
public record SegmentsParams(
    @JsonProperty("index")
    @JsonPropertyDescription("Limit the information returned to the specified indices. If not provided, returns segments for all indices.")
    String index
) {}
