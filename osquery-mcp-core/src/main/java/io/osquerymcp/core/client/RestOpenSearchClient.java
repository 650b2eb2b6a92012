package io.osquerymcp.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.osquerymcp.core.args.ClusterTarget;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link OpenSearchClient} that maps every capability onto a REST request and
 * leaves the transport to {@link #execute(ClusterTarget, ApiRequest)}.
 */
public abstract class RestOpenSearchClient implements OpenSearchClient {

    private static final Map<String, Object> JSON_FORMAT = Map.of("format", "json");

    @Override
    public String getClusterVersion(ClusterTarget target) {
        JsonNode info = execute(target, ApiRequest.get("/"));
        JsonNode number = info.path("version").path("number");
        if (!number.isTextual() || number.asText().isBlank()) {
            throw new UpstreamCallException("Cluster info response did not contain version.number");
        }
        return number.asText();
    }

    @Override
    public JsonNode listIndices(ClusterTarget target) {
        return execute(target, ApiRequest.get("/_cat/indices", JSON_FORMAT));
    }

    @Override
    public JsonNode getIndex(ClusterTarget target, String index) {
        return execute(target, ApiRequest.get(path(index)));
    }

    @Override
    public JsonNode getIndexMapping(ClusterTarget target, String index) {
        return execute(target, ApiRequest.get(path(index, "_mapping")));
    }

    @Override
    public JsonNode search(ClusterTarget target, String index, JsonNode query) {
        return execute(target, ApiRequest.post(path(index, "_search"), query));
    }

    @Override
    public JsonNode getClusterState(ClusterTarget target, String metric, String index) {
        String path;
        if (isSet(metric)) {
            path = isSet(index) ? path("_cluster", "state", metric, index) : path("_cluster", "state", metric);
        } else if (isSet(index)) {
            // index filtering requires a metric segment
            path = path("_cluster", "state", "_all", index);
        } else {
            path = path("_cluster", "state");
        }
        return execute(target, ApiRequest.get(path));
    }

    @Override
    public JsonNode getIndexInfo(ClusterTarget target, String index) {
        return execute(target, ApiRequest.get(path(index)));
    }

    @Override
    public JsonNode getIndexStats(ClusterTarget target, String index, String metric) {
        String path = isSet(metric) ? path(index, "_stats", metric) : path(index, "_stats");
        return execute(target, ApiRequest.get(path));
    }

    @Override
    public JsonNode getQueryInsights(ClusterTarget target) {
        return execute(target, ApiRequest.get(path("_insights", "top_queries")));
    }

    @Override
    public JsonNode getShards(ClusterTarget target, String index) {
        return execute(target, ApiRequest.get(path("_cat", "shards", index), JSON_FORMAT));
    }

    @Override
    public JsonNode getSegments(ClusterTarget target, String index) {
        String path = isSet(index) ? path("_cat", "segments", index) : path("_cat", "segments");
        return execute(target, ApiRequest.get(path, JSON_FORMAT));
    }

    @Override
    public JsonNode catNodes(ClusterTarget target, String metrics) {
        Map<String, Object> query = new LinkedHashMap<>(JSON_FORMAT);
        if (isSet(metrics)) {
            query.put("h", metrics);
        }
        return execute(target, ApiRequest.get(path("_cat", "nodes"), query));
    }

    @Override
    public JsonNode getNodes(ClusterTarget target, String nodeId, String metric) {
        List<String> segments = new ArrayList<>(List.of("_nodes"));
        if (isSet(nodeId)) {
            segments.add(nodeId);
        }
        if (isSet(metric)) {
            segments.add(metric);
        }
        return execute(target, ApiRequest.get(path(segments.toArray(new String[0]))));
    }

    @Override
    public JsonNode getNodesHotThreads(ClusterTarget target, String nodeId) {
        String path = isSet(nodeId) ? path("_nodes", nodeId, "hot_threads") : path("_nodes", "hot_threads");
        return execute(target, ApiRequest.get(path));
    }

    @Override
    public JsonNode getAllocation(ClusterTarget target, String nodeId) {
        String path = isSet(nodeId) ? path("_cat", "allocation", nodeId) : path("_cat", "allocation");
        return execute(target, ApiRequest.get(path, JSON_FORMAT));
    }

    @Override
    public JsonNode getLongRunningTasks(ClusterTarget target, int limit) {
        Map<String, Object> query = new LinkedHashMap<>(JSON_FORMAT);
        query.put("detailed", true);
        query.put("s", "running_time:desc");
        JsonNode tasks = execute(target, ApiRequest.get(path("_cat", "tasks"), query));
        if (!tasks.isArray() || tasks.size() <= limit) {
            return tasks;
        }
        ArrayNode limited = JsonNodeFactory.instance.arrayNode();
        for (int i = 0; i < limit; i++) {
            limited.add(tasks.get(i));
        }
        return limited;
    }

    /**
     * Join segments into a request path, percent-encoding each one. Only unreserved
     * characters plus {@code ,} and {@code *} (index lists and wildcards) pass through,
     * so a value can never add segments, a query string or a fragment.
     */
    static String path(String... segments) {
        StringBuilder path = new StringBuilder();
        for (String segment : segments) {
            path.append('/').append(encodeSegment(segment.trim()));
        }
        return path.toString();
    }

    static String encodeSegment(String segment) {
        StringBuilder encoded = new StringBuilder(segment.length());
        for (byte b : segment.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (isSegmentSafe(c)) {
                encoded.append((char) c);
            } else {
                encoded.append('%')
                    .append(Character.toUpperCase(Character.forDigit(c >> 4, 16)))
                    .append(Character.toUpperCase(Character.forDigit(c & 0xF, 16)));
            }
        }
        return encoded.toString();
    }

    private static boolean isSegmentSafe(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
            || c == '-' || c == '.' || c == '_' || c == '~' || c == ',' || c == '*';
    }

    static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
