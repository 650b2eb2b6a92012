package io.osquerymcp.spring;

import io.osquerymcp.core.args.ClusterTarget;
import io.osquerymcp.core.client.ClusterConnection;
import io.osquerymcp.core.client.ClusterConnectionResolver;
import io.osquerymcp.core.client.UnknownClusterException;

import java.time.Duration;

/**
 * Resolves cluster targets from {@link OsQueryProperties}.
 *
 * <p>The default target uses {@code osquery.opensearch.*}. A named target uses
 * {@code osquery.clusters.<name>.*}; timeouts it leaves unset are taken from the
 * default cluster.
 */
public class PropertiesClusterConnectionResolver implements ClusterConnectionResolver {

    public static final String DEFAULT_CLUSTER = "default";
    public static final String DEFAULT_URL = "http://localhost:9200";

    private final OsQueryProperties properties;

    public PropertiesClusterConnectionResolver(OsQueryProperties properties) {
        this.properties = properties;
    }

    @Override
    public ClusterConnection resolve(ClusterTarget target) {
        OsQueryProperties.Cluster defaults = properties.getOpensearch();
        if (target == null || target.isDefault()) {
            String url = defaults.getUrl() != null && !defaults.getUrl().isBlank() ? defaults.getUrl() : DEFAULT_URL;
            return new ClusterConnection(DEFAULT_CLUSTER, url, defaults.getUsername(), defaults.getPassword(),
                defaults.getConnectTimeout(), defaults.getReadTimeout());
        }

        OsQueryProperties.Cluster cluster = properties.getClusters().get(target.clusterName());
        if (cluster == null) {
            throw new UnknownClusterException(target.clusterName());
        }
        return new ClusterConnection(target.clusterName(), cluster.getUrl(),
            cluster.getUsername(), cluster.getPassword(),
            orDefault(cluster.getConnectTimeout(), defaults.getConnectTimeout()),
            orDefault(cluster.getReadTimeout(), defaults.getReadTimeout()));
    }

    private static Duration orDefault(Duration value, Duration fallback) {
        return value != null ? value : fallback;
    }
}
