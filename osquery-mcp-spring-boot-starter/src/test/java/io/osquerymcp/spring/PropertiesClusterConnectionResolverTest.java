package io.osquerymcp.spring;

import io.osquerymcp.core.args.ClusterTarget;
import io.osquerymcp.core.client.ClusterConnection;
import io.osquerymcp.core.client.UnknownClusterException;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

class PropertiesClusterConnectionResolverTest {

    private OsQueryProperties properties;
    private PropertiesClusterConnectionResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new OsQueryProperties();
        resolver = new PropertiesClusterConnectionResolver(properties);
    }

    @Test
    @DisplayName("default cluster falls back to localhost:9200")
    void defaultUrl() {
        ClusterConnection connection = resolver.resolve(ClusterTarget.defaultCluster());

        assertEquals("default", connection.name());
        assertEquals("http://localhost:9200", connection.url());
        assertFalse(connection.hasCredentials());
        assertEquals(Duration.ofSeconds(10), connection.connectTimeout());
        assertEquals(Duration.ofSeconds(60), connection.readTimeout());
    }

    @Test
    @DisplayName("named cluster inherits unset timeouts from the default cluster")
    void namedCluster() {
        properties.getOpensearch().setReadTimeout(Duration.ofSeconds(5));
        OsQueryProperties.Cluster prod = new OsQueryProperties.Cluster();
        prod.setUrl("https://prod:9200");
        prod.setUsername("reader");
        prod.setPassword("secret");
        properties.getClusters().put("prod", prod);

        ClusterConnection connection = resolver.resolve(ClusterTarget.named("prod"));

        assertEquals("https://prod:9200", connection.url());
        assertTrue(connection.hasCredentials());
        assertEquals(Duration.ofSeconds(5), connection.readTimeout());
        assertFalse(connection.toString().contains("secret"));
    }

    @Test
    @DisplayName("unknown cluster name is rejected")
    void unknownCluster() {
        UnknownClusterException e = assertThrows(UnknownClusterException.class,
            () -> resolver.resolve(ClusterTarget.named("staging")));
        assertTrue(e.getMessage().contains("'staging'"));
    }

    @Test
    @DisplayName("advertised name carries the namespace")
    void advertisedName() {
        assertEquals("os-query-mcp (opensearch_query)", properties.advertisedName());
        properties.setNamespace("");
        assertEquals("os-query-mcp", properties.advertisedName());
    }
}
