package io.osquerymcp.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.osquerymcp.core.args.ClusterTarget;

/**
 * Calls into an OpenSearch cluster's REST API, one method per tool capability.
 *
 * <p>Every method either returns the decoded response or throws
 * {@link UpstreamCallException} (or {@link UnknownClusterException}). An interrupted
 * call surfaces as {@link java.util.concurrent.CancellationException}. Implementations
 * do not retry.
 */
public interface OpenSearchClient {

    /**
     * @return The cluster's {@code version.number}
     */
    String getClusterVersion(ClusterTarget target);

    /** {@code GET /_cat/indices?format=json} */
    JsonNode listIndices(ClusterTarget target);

    /** {@code GET /{index}} */
    JsonNode getIndex(ClusterTarget target, String index);

    /** {@code GET /{index}/_mapping} */
    JsonNode getIndexMapping(ClusterTarget target, String index);

    /** {@code POST /{index}/_search} */
    JsonNode search(ClusterTarget target, String index, JsonNode query);

    /** {@code GET /_cluster/state[/{metric}[/{index}]]} */
    JsonNode getClusterState(ClusterTarget target, String metric, String index);

    /** {@code GET /{index}} with mappings, settings and aliases */
    JsonNode getIndexInfo(ClusterTarget target, String index);

    /** {@code GET /{index}/_stats[/{metric}]} */
    JsonNode getIndexStats(ClusterTarget target, String index, String metric);

    /** {@code GET /_insights/top_queries} */
    JsonNode getQueryInsights(ClusterTarget target);

    /** {@code GET /_cat/shards/{index}?format=json} */
    JsonNode getShards(ClusterTarget target, String index);

    /** {@code GET /_cat/segments[/{index}]?format=json} */
    JsonNode getSegments(ClusterTarget target, String index);

    /** {@code GET /_cat/nodes?format=json[&h=metrics]} */
    JsonNode catNodes(ClusterTarget target, String metrics);

    /** {@code GET /_nodes[/{nodeId}][/{metric}]} */
    JsonNode getNodes(ClusterTarget target, String nodeId, String metric);

    /** {@code GET /_nodes[/{nodeId}]/hot_threads} (plain text) */
    JsonNode getNodesHotThreads(ClusterTarget target, String nodeId);

    /** {@code GET /_cat/allocation[/{nodeId}]?format=json} */
    JsonNode getAllocation(ClusterTarget target, String nodeId);

    /** {@code GET /_cat/tasks?format=json&detailed=true}, longest-running first, at most {@code limit} */
    JsonNode getLongRunningTasks(ClusterTarget target, int limit);

    /**
     * Perform an arbitrary request and return the decoded response.
     */
    JsonNode execute(ClusterTarget target, ApiRequest request);
}
