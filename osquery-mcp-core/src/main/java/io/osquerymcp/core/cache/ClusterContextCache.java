package io.osquerymcp.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.osquerymcp.core.args.ClusterTarget;
import io.osquerymcp.core.client.OpenSearchClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-cluster cache of the detailed index listing and of index mappings.
 *
 * <p>Entries are loaded on first use and kept until invalidated. A failed load
 * leaves no entry behind. Loads run outside the maps, so concurrent first calls may
 * both reach the cluster; the first stored result wins. At most
 * {@code maxMappingsPerCluster} mappings are kept per cluster, further ones are
 * fetched on every call.
 */
public class ClusterContextCache {

    private static final Logger log = LoggerFactory.getLogger(ClusterContextCache.class);

    public static final int DEFAULT_MAX_MAPPINGS_PER_CLUSTER = 256;

    private final OpenSearchClient client;
    private final int maxMappingsPerCluster;
    private final Map<ClusterTarget, ClusterContext> contexts = new ConcurrentHashMap<>();

    public ClusterContextCache(OpenSearchClient client) {
        this(client, DEFAULT_MAX_MAPPINGS_PER_CLUSTER);
    }

    public ClusterContextCache(OpenSearchClient client, int maxMappingsPerCluster) {
        if (maxMappingsPerCluster < 0) {
            throw new IllegalArgumentException("maxMappingsPerCluster must not be negative");
        }
        this.client = client;
        this.maxMappingsPerCluster = maxMappingsPerCluster;
    }

    /**
     * @param target Cluster to query
     * @return The cat.indices rows for the cluster, loaded once
     */
    public JsonNode allIndices(ClusterTarget target) {
        ClusterContext context = contextFor(target);
        JsonNode cached = context.indices.get();
        if (cached != null) {
            return cached;
        }
        log.debug("Loading index listing for cluster {}", target);
        JsonNode loaded = client.listIndices(target);
        return context.indices.compareAndSet(null, loaded) ? loaded : context.indices.get();
    }

    /**
     * @param target Cluster to query
     * @param index  Index name
     * @return The index mapping, loaded once per index
     */
    public JsonNode indexMapping(ClusterTarget target, String index) {
        ClusterContext context = contextFor(target);
        JsonNode cached = context.mappings.get(index);
        if (cached != null) {
            return cached;
        }
        log.debug("Loading mapping of {} for cluster {}", index, target);
        JsonNode loaded = client.getIndexMapping(target, index);
        if (context.mappings.size() >= maxMappingsPerCluster) {
            log.debug("Mapping cache for cluster {} is full, not caching {}", target, index);
            return loaded;
        }
        JsonNode previous = context.mappings.putIfAbsent(index, loaded);
        return previous != null ? previous : loaded;
    }

    public Optional<JsonNode> cachedIndices(ClusterTarget target) {
        ClusterContext context = contexts.get(target);
        return context == null ? Optional.empty() : Optional.ofNullable(context.indices.get());
    }

    public void invalidate(ClusterTarget target) {
        if (contexts.remove(target) != null) {
            log.info("Invalidated cached context for cluster {}", target);
        }
    }

    public void invalidateAll() {
        contexts.clear();
        log.info("Invalidated all cached cluster contexts");
    }

    private ClusterContext contextFor(ClusterTarget target) {
        return contexts.computeIfAbsent(target, t -> new ClusterContext());
    }

    private static final class ClusterContext {
        private final AtomicReference<JsonNode> indices = new AtomicReference<>();
        private final Map<String, JsonNode> mappings = new ConcurrentHashMap<>();
    }
}
