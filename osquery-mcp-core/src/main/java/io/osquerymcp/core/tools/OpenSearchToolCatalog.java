package io.osquerymcp.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.osquerymcp.core.OsQueryObjectMappers;
import io.osquerymcp.core.args.AllocationParams;
import io.osquerymcp.core.args.ArgumentModel;
import io.osquerymcp.core.args.CatNodesParams;
import io.osquerymcp.core.args.ClusterStateParams;
import io.osquerymcp.core.args.GenericApiParams;
import io.osquerymcp.core.args.IndexInfoParams;
import io.osquerymcp.core.args.IndexMappingParams;
import io.osquerymcp.core.args.IndexStatsParams;
import io.osquerymcp.core.args.ListIndicesParams;
import io.osquerymcp.core.args.LongRunningTasksParams;
import io.osquerymcp.core.args.NodesHotThreadsParams;
import io.osquerymcp.core.args.NodesParams;
import io.osquerymcp.core.args.QueryInsightsParams;
import io.osquerymcp.core.args.SearchIndexParams;
import io.osquerymcp.core.args.SegmentsParams;
import io.osquerymcp.core.args.ShardsParams;
import io.osquerymcp.core.client.OpenSearchClient;
import io.osquerymcp.core.compat.CompatibilityGate;
import io.osquerymcp.core.registry.HttpVerb;
import io.osquerymcp.core.registry.ToolDescriptor;
import io.osquerymcp.core.registry.ToolRegistry;
import io.osquerymcp.core.version.VersionRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * The built-in OpenSearch tool set.
 *
 * <p>Wiring order matters: the registry is created empty, the gate is built over
 * it, and only then are the handlers (which hold the gate) registered.
 */
public final class OpenSearchToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(OpenSearchToolCatalog.class);

    private static final ObjectMapper MAPPER = OsQueryObjectMappers.create();

    public static final String LIST_INDICES = "ListIndexTool";
    public static final String INDEX_MAPPING = "IndexMappingTool";
    public static final String SEARCH_INDEX = "SearchIndexTool";
    public static final String CLUSTER_STATE = "GetClusterStateTool";
    public static final String INDEX_INFO = "GetIndexInfoTool";
    public static final String INDEX_STATS = "GetIndexStatsTool";
    public static final String QUERY_INSIGHTS = "GetQueryInsightsTool";
    public static final String GENERIC_API = "GenericOpenSearchApiTool";
    public static final String SHARDS = "GetShardsTool";
    public static final String SEGMENTS = "GetSegmentsTool";
    public static final String CAT_NODES = "CatNodesTool";
    public static final String NODES = "GetNodesTool";
    public static final String NODES_HOT_THREADS = "GetNodesHotThreadsTool";
    public static final String ALLOCATION = "GetAllocationTool";
    public static final String LONG_RUNNING_TASKS = "GetLongRunningTasksTool";

    private static final VersionRange SINCE_1_0 = VersionRange.atLeast("1.0.0");
    private static final Set<HttpVerb> GET_ONLY = HttpVerb.of(HttpVerb.GET);

    private OpenSearchToolCatalog() {}

    /**
     * Build a registry holding every built-in tool.
     *
     * @param client OpenSearch client used by the handlers
     * @return Populated registry
     */
    public static ToolRegistry createRegistry(OpenSearchClient client) {
        ToolRegistry registry = new ToolRegistry();
        registerAll(registry, new CompatibilityGate(registry), client);
        return registry;
    }

    /**
     * Register every built-in tool.
     *
     * @param registry Registry to populate
     * @param gate     Gate over {@code registry}
     * @param client   OpenSearch client used by the handlers
     * @throws io.osquerymcp.core.registry.DuplicateToolException if a tool is already registered
     */
    public static void registerAll(ToolRegistry registry, CompatibilityGate gate, OpenSearchClient client) {
        registry.register(new ToolDescriptor<>(
            LIST_INDICES, LIST_INDICES,
            "Lists indices in the OpenSearch cluster. By default, returns a filtered list of index names only "
                + "to minimize response size. Set include_detail=true to return full metadata from cat.indices "
                + "(docs.count, store.size, etc.). If an index parameter is provided, returns detailed information "
                + "for that specific index including mappings and settings.",
            ArgumentModel.of(ListIndicesParams.class),
            new ListIndicesToolHandler(gate, client),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            INDEX_MAPPING, INDEX_MAPPING,
            "Retrieves index mapping and setting information for an index in OpenSearch",
            ArgumentModel.of(IndexMappingParams.class),
            new CapabilityToolHandler<IndexMappingParams>(INDEX_MAPPING, "Error getting mapping", gate, client,
                (c, args) -> c.getIndexMapping(args.cluster(), args.params().index())),
            VersionRange.unbounded(), GET_ONLY));

        registry.register(new ToolDescriptor<>(
            SEARCH_INDEX, SEARCH_INDEX,
            "Searches an index using a query written in query domain-specific language (DSL) in OpenSearch",
            ArgumentModel.of(SearchIndexParams.class),
            new CapabilityToolHandler<SearchIndexParams>(SEARCH_INDEX, "Error searching index", gate, client,
                (c, args) -> c.search(args.cluster(), args.params().index(), MAPPER.valueToTree(args.params().query()))),
            VersionRange.unbounded(), HttpVerb.of(HttpVerb.GET, HttpVerb.POST)));

        registry.register(new ToolDescriptor<>(
            CLUSTER_STATE, CLUSTER_STATE,
            "Gets the current state of the cluster including node information, index settings, and more. "
                + "Can be filtered by specific metrics and indices.",
            ArgumentModel.of(ClusterStateParams.class),
            new CapabilityToolHandler<ClusterStateParams>(CLUSTER_STATE, "Error getting cluster state", gate, client,
                (c, args) -> c.getClusterState(args.cluster(), args.params().metric(), args.params().index())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            INDEX_INFO, INDEX_INFO,
            "Gets detailed information about an index including mappings, settings, and aliases. "
                + "Supports wildcards in index names.",
            ArgumentModel.of(IndexInfoParams.class),
            new CapabilityToolHandler<IndexInfoParams>(INDEX_INFO, "Error getting index information", gate, client,
                (c, args) -> c.getIndexInfo(args.cluster(), args.params().index())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            INDEX_STATS, INDEX_STATS,
            "Gets statistics about an index including document count, store size, indexing and search "
                + "performance metrics. Can be filtered to specific metrics.",
            ArgumentModel.of(IndexStatsParams.class),
            new CapabilityToolHandler<IndexStatsParams>(INDEX_STATS, "Error getting index statistics", gate, client,
                (c, args) -> c.getIndexStats(args.cluster(), args.params().index(), args.params().metric())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            QUERY_INSIGHTS, QUERY_INSIGHTS,
            "Gets query insights from the /_insights/top_queries endpoint, showing information about query "
                + "patterns and performance.",
            ArgumentModel.of(QueryInsightsParams.class),
            new CapabilityToolHandler<QueryInsightsParams>(QUERY_INSIGHTS, "Error getting query insights", gate, client,
                (c, args) -> c.getQueryInsights(args.cluster())),
            // top_queries shipped with the query insights plugin in 2.12
            VersionRange.atLeast("2.12.0"), GET_ONLY));

        registry.register(new ToolDescriptor<>(
            GENERIC_API, GENERIC_API,
            "A flexible tool for calling any OpenSearch API endpoint. Supports all HTTP methods with custom paths, "
                + "query parameters, request bodies, and headers. Use this when you need to access OpenSearch APIs "
                + "that don't have dedicated tools, or when you need more control over the request. Leverages your "
                + "knowledge of OpenSearch API documentation to construct appropriate requests.",
            ArgumentModel.of(GenericApiParams.class),
            new GenericApiToolHandler(gate, client),
            SINCE_1_0, HttpVerb.all()));

        registry.register(new ToolDescriptor<>(
            SHARDS, SHARDS,
            "Gets information about shards in OpenSearch.",
            ArgumentModel.of(ShardsParams.class),
            new CapabilityToolHandler<ShardsParams>(SHARDS, "Error getting shards information", gate, client,
                (c, args) -> c.getShards(args.cluster(), args.params().index())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            SEGMENTS, SEGMENTS,
            "Gets information about Lucene segments in indices, including memory usage, document counts, "
                + "and segment sizes. Can be filtered by specific indices.",
            ArgumentModel.of(SegmentsParams.class),
            new CapabilityToolHandler<SegmentsParams>(SEGMENTS, "Error getting segment information", gate, client,
                (c, args) -> c.getSegments(args.cluster(), args.params().index())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            CAT_NODES, CAT_NODES,
            "Lists node-level information, including node roles and load metrics. Gives key performance "
                + "statistics for each node.",
            ArgumentModel.of(CatNodesParams.class),
            new CapabilityToolHandler<CatNodesParams>(CAT_NODES, "Error getting node information", gate, client,
                (c, args) -> c.catNodes(args.cluster(), args.params().metrics())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            NODES, NODES,
            "Gets detailed information about nodes in the cluster, including settings, OS, JVM, thread pools "
                + "and plugins. Can be filtered by node and metric.",
            ArgumentModel.of(NodesParams.class),
            new CapabilityToolHandler<NodesParams>(NODES, "Error getting nodes information", gate, client,
                (c, args) -> c.getNodes(args.cluster(), args.params().nodeId(), args.params().metric())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            NODES_HOT_THREADS, NODES_HOT_THREADS,
            "Gets the threads using the most CPU on each node. Useful for diagnosing performance problems.",
            ArgumentModel.of(NodesHotThreadsParams.class),
            new CapabilityToolHandler<NodesHotThreadsParams>(NODES_HOT_THREADS,
                "Error getting hot threads information", gate, client,
                (c, args) -> c.getNodesHotThreads(args.cluster(), args.params().nodeId())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            ALLOCATION, ALLOCATION,
            "Gets shard allocation and disk usage per node.",
            ArgumentModel.of(AllocationParams.class),
            new CapabilityToolHandler<AllocationParams>(ALLOCATION, "Error getting allocation information", gate, client,
                (c, args) -> c.getAllocation(args.cluster(), args.params().nodeId())),
            SINCE_1_0, GET_ONLY));

        registry.register(new ToolDescriptor<>(
            LONG_RUNNING_TASKS, LONG_RUNNING_TASKS,
            "Lists the tasks that have been running the longest in the cluster, sorted by running time.",
            ArgumentModel.of(LongRunningTasksParams.class),
            new CapabilityToolHandler<LongRunningTasksParams>(LONG_RUNNING_TASKS,
                "Error getting long-running tasks information", gate, client,
                (c, args) -> c.getLongRunningTasks(args.cluster(), args.params().limit())),
            SINCE_1_0, GET_ONLY));

        log.info("Registered {} OpenSearch tools", registry.size());
    }
}
