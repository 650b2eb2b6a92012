package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Parameters for GetLongRunningTasksTool.
 *
 * @param limit Maximum number of tasks to return, longest-running first
 */
public record LongRunningTasksParams(
    @JsonProperty(value = "limit", defaultValue = "10")
    @JsonPropertyDescription("The maximum number of tasks to return. Tasks are sorted by running time, longest first.")
    Integer limit
) implements ValidatedParams {

    public static final int DEFAULT_LIMIT = 10;

    public LongRunningTasksParams {
        limit = limit != null ? limit : DEFAULT_LIMIT;
    }

    @Override
    public List<ValidationError> validate() {
        if (limit < 1) {
            return List.of(new ValidationError("limit", "must be at least 1"));
        }
        return List.of();
    }
}
