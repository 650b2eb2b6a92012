package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Parameters for ListIndexTool.
 *
 * @param index         Specific index to describe; blank lists every index
 * @param includeDetail Return full cat.indices rows instead of bare index names
 */
public record ListIndicesParams(
    @JsonProperty(value = "index", defaultValue = "")
    @JsonPropertyDescription("The name of the index to get detailed information for. If provided, returns detailed information about this specific index instead of listing all indices.")
    String index,

    @JsonProperty(value = "include_detail", defaultValue = "false")
    @JsonPropertyDescription("Whether to include detailed information. When listing indices (no index specified), if false, returns only a pure list of index names. If true, returns full metadata.")
    boolean includeDetail
) {

    public boolean hasIndex() {
        return index != null && !index.isBlank();
    }
}
