package io.osquerymcp.core.client;

import java.time.Duration;

/**
 * Connection details for one OpenSearch cluster.
 *
 * @param name           Configured name ("default" for the default cluster)
 * @param url            Base URL, e.g. {@code https://search.example.com:9200}
 * @param username       Basic auth user, or null
 * @param password       Basic auth password, or null
 * @param connectTimeout Connect timeout
 * @param readTimeout    Read timeout
 */
public record ClusterConnection(
    String name,
    String url,
    String username,
    String password,
    Duration connectTimeout,
    Duration readTimeout
) {

    public ClusterConnection {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("OpenSearch URL is not configured for cluster '" + name + "'");
        }
        connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(10);
        readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(60);
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return "ClusterConnection[name=" + name + ", url=" + url + ", user=" + username + "]";
    }
}
