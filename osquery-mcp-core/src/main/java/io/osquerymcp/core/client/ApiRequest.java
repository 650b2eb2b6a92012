package io.osquerymcp.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.osquerymcp.core.registry.HttpVerb;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single REST request to an OpenSearch cluster.
 *
 * @param method      HTTP verb
 * @param path        Path beginning with '/', already escaped where needed
 * @param queryParams Query parameters (values rendered with {@code String.valueOf})
 * @param body        Body, or null; a text node is sent verbatim
 * @param headers     Extra headers
 */
public record ApiRequest(
    HttpVerb method,
    String path,
    Map<String, Object> queryParams,
    JsonNode body,
    Map<String, String> headers
) {

    public ApiRequest {
        queryParams = queryParams != null ? Collections.unmodifiableMap(new LinkedHashMap<>(queryParams)) : Map.of();
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    }

    public static ApiRequest get(String path) {
        return new ApiRequest(HttpVerb.GET, path, null, null, null);
    }

    public static ApiRequest get(String path, Map<String, Object> queryParams) {
        return new ApiRequest(HttpVerb.GET, path, queryParams, null, null);
    }

    public static ApiRequest post(String path, JsonNode body) {
        return new ApiRequest(HttpVerb.POST, path, null, body, null);
    }
}
