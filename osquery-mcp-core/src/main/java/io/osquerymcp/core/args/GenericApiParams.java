package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import io.osquerymcp.core.registry.HttpVerb;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parameters for GenericOpenSearchApiTool: a free-form request.
 *
 * @param method      HTTP verb, case-insensitive
 * @param path        API path, e.g. {@code /_cluster/health}
 * @param queryParams Query string parameters
 * @param body        Request body; objects are sent as JSON, strings as-is (e.g. NDJSON)
 * @param headers     Additional request headers
 */
public record GenericApiParams(
    @JsonProperty(value = "method", required = true)
    @JsonPropertyDescription("HTTP method to use (GET, POST, PUT, DELETE, HEAD, PATCH)")
    String method,

    @JsonProperty(value = "path", required = true)
    @JsonPropertyDescription("API endpoint path, e.g. /_cluster/health or /my-index/_doc/1")
    String path,

    @JsonProperty("query_params")
    @JsonPropertyDescription("Query parameters to append to the URL, e.g. {\"pretty\": true, \"v\": true}")
    Map<String, Object> queryParams,

    @JsonProperty("body")
    @JsonPropertyDescription("Request body. Objects are sent as JSON; strings are sent verbatim (e.g. NDJSON for _bulk).")
    Object body,

    @JsonProperty("headers")
    @JsonPropertyDescription("Additional HTTP headers to send with the request")
    Map<String, String> headers
) implements ValidatedParams {

    @Override
    public List<ValidationError> validate() {
        List<ValidationError> errors = new ArrayList<>();
        if (HttpVerb.lookup(method).isEmpty()) {
            errors.add(new ValidationError("method", "must be one of GET, POST, PUT, DELETE, HEAD, PATCH"));
        }
        if (path == null || path.isBlank()) {
            errors.add(new ValidationError("path", "must not be blank"));
        }
        return errors;
    }

    public HttpVerb verb() {
        return HttpVerb.lookup(method).orElseThrow(() -> new IllegalStateException("Unvalidated method: " + method));
    }

    /**
     * @return The path with a leading slash
     */
    public String normalizedPath() {
        String trimmed = path.trim();
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }
}
