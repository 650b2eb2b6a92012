package io.osquerymcp.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the OpenSearch query MCP server.
 *
 * <p>These properties can be set in application.yml or application.properties:
 * <pre>
 * osquery:
 *   transport: http
 *   opensearch:
 *     url: http://localhost:9200
 *   clusters:
 *     prod:
 *       url: https://prod.example.com:9200
 *       username: reader
 * </pre>
 *
 * <p>Environment variables are wired in through placeholders in application.yml:
 * <ul>
 *   <li>{@code OSQUERYMCP_TRANSPORT}</li>
 *   <li>{@code OSQUERYMCP_NAMESPACE}</li>
 *   <li>{@code OPENSEARCH_URL}, {@code OPENSEARCH_USERNAME}, {@code OPENSEARCH_PASSWORD}</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "osquery")
public class OsQueryProperties {

    /**
     * How MCP clients reach the server.
     */
    public enum TransportMode {
        STDIO,
        HTTP,
        SSE
    }

    private TransportMode transport = TransportMode.HTTP;
    private String namespace = "opensearch_query";
    private String endpoint = "/mcp";
    private String sseEndpoint = "/sse";
    private String messageEndpoint = "/mcp/message";
    private List<String> allowedOrigins = new ArrayList<>();
    private List<String> allowedHosts = new ArrayList<>();
    private int toolThreads = 8;

    private final Server server = new Server();
    private final Cluster opensearch = new Cluster();
    private final Map<String, Cluster> clusters = new LinkedHashMap<>();

    public TransportMode getTransport() {
        return transport;
    }

    public void setTransport(TransportMode transport) {
        this.transport = transport;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getSseEndpoint() {
        return sseEndpoint;
    }

    public void setSseEndpoint(String sseEndpoint) {
        this.sseEndpoint = sseEndpoint;
    }

    public String getMessageEndpoint() {
        return messageEndpoint;
    }

    public void setMessageEndpoint(String messageEndpoint) {
        this.messageEndpoint = messageEndpoint;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public List<String> getAllowedHosts() {
        return allowedHosts;
    }

    public void setAllowedHosts(List<String> allowedHosts) {
        this.allowedHosts = allowedHosts;
    }

    public int getToolThreads() {
        return toolThreads;
    }

    public void setToolThreads(int toolThreads) {
        this.toolThreads = toolThreads;
    }

    public Server getServer() {
        return server;
    }

    /**
     * The default cluster, used when a call names no cluster.
     */
    public Cluster getOpensearch() {
        return opensearch;
    }

    /**
     * Named clusters, selected with the {@code opensearch_cluster_name} argument.
     */
    public Map<String, Cluster> getClusters() {
        return clusters;
    }

    /**
     * Name advertised to MCP clients, with the namespace appended when set.
     */
    public String advertisedName() {
        String name = server.getName();
        return namespace != null && !namespace.isBlank() ? name + " (" + namespace + ")" : name;
    }

    public static class Server {
        private String name = "os-query-mcp";
        private String version = "1.0.0";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }
    }

    public static class Cluster {
        private String url;
        private String username;
        private String password;
        private Duration connectTimeout;
        private Duration readTimeout;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
