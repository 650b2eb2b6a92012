package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.Map;

/**
 * Parameters for SearchIndexTool.
 *
 * @param index Index (or pattern) to search
 * @param query Query DSL request body
 */
public record SearchIndexParams(
    @JsonProperty(value = "index", required = true)
    @JsonPropertyDescription("The name of the index to search in")
    String index,

    @JsonProperty(value = "query", required = true)
    @JsonPropertyDescription("The search query in OpenSearch query DSL format")
    Map<String, Object> query
) {}
