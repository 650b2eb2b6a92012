package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for GetIndexStatsTool.
 */
public record IndexStatsParams(
    @JsonProperty(value = "index", required = true)
    @JsonPropertyDescription("The name of the index to get statistics for. Wildcards are supported.")
    String index,

    @JsonProperty("metric")
    @JsonPropertyDescription("Limit the information returned to the specified metrics. Options include: _all, completion, docs, fielddata, flush, get, indexing, merge, query_cache, refresh, request_cache, search, segments, store, warmer, bulk")
    String metric
) {}
