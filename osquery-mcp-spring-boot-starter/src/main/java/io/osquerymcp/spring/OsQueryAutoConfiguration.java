package io.osquerymcp.spring;

import io.osquerymcp.core.OsQueryObjectMappers;
import io.osquerymcp.core.cache.ClusterContextCache;
import io.osquerymcp.core.client.ClusterConnectionResolver;
import io.osquerymcp.core.client.OpenSearchClient;
import io.osquerymcp.core.compat.CompatibilityGate;
import io.osquerymcp.core.registry.ToolRegistry;
import io.osquerymcp.core.tools.OpenSearchToolCatalog;
import io.osquerymcp.core.tools.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.Ordered;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Boot auto-configuration for the OpenSearch query MCP server.
 *
 * <p>Creates:
 * <ul>
 *   <li>{@link ClusterConnectionResolver} - maps cluster names to connections</li>
 *   <li>{@link OpenSearchClient} - OkHttp-backed REST client</li>
 *   <li>{@link ToolRegistry} - the built-in tool catalog</li>
 *   <li>{@link ToolDispatcher} - name-based tool invocation</li>
 *   <li>{@link ClusterContextCache} - cached index listings and mappings</li>
 * </ul>
 * MCP transports are configured by {@link OsQueryMcpServerConfiguration}.
 */
@Configuration
@EnableConfigurationProperties(OsQueryProperties.class)
@Import(OsQueryMcpServerConfiguration.class)
public class OsQueryAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OsQueryAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public static ClusterConnectionResolver osQueryClusterConnectionResolver(OsQueryProperties properties) {
        return new PropertiesClusterConnectionResolver(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public static OpenSearchClient osQueryOpenSearchClient(ClusterConnectionResolver resolver) {
        return new OkHttpOpenSearchClient(resolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public static ToolRegistry osQueryToolRegistry(OpenSearchClient client) {
        ToolRegistry registry = new ToolRegistry();
        OpenSearchToolCatalog.registerAll(registry, new CompatibilityGate(registry), client);
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "osQueryToolExecutor")
    public static ExecutorService osQueryToolExecutor(OsQueryProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getToolThreads()), r -> {
            Thread thread = new Thread(r, "osquery-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public static ToolDispatcher osQueryToolDispatcher(
            ToolRegistry registry,
            @Qualifier("osQueryToolExecutor") ExecutorService executor) {
        return new ToolDispatcher(registry, executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public static ClusterContextCache osQueryClusterContextCache(OpenSearchClient client) {
        return new ClusterContextCache(client);
    }

    @Bean
    @ConditionalOnMissingBean
    public static McpToolAdapter osQueryMcpToolAdapter(ToolDispatcher dispatcher) {
        // MCP SDK serializes with Jackson 2; keep a dedicated mapper for tool payloads
        return new McpToolAdapter(dispatcher, OsQueryObjectMappers.create());
    }

    /**
     * HTTP-only beans: endpoints, CORS and host checking.
     */
    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public OsQueryHealthController osQueryHealthController(ToolRegistry registry, OsQueryProperties properties) {
            return new OsQueryHealthController(registry, properties);
        }

        @Bean
        @ConditionalOnMissingBean
        public ToolCatalogController osQueryToolCatalogController(ToolRegistry registry) {
            return new ToolCatalogController(registry);
        }

        @Bean
        @ConditionalOnMissingBean
        public ClusterContextController osQueryClusterContextController(ClusterContextCache cache) {
            return new ClusterContextController(cache);
        }

        @Bean
        public FilterRegistrationBean<TrustedHostFilter> osQueryTrustedHostFilter(OsQueryProperties properties) {
            FilterRegistrationBean<TrustedHostFilter> registration = new FilterRegistrationBean<>();
            registration.setFilter(new TrustedHostFilter(properties.getAllowedHosts()));
            registration.addUrlPatterns("/*");
            registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
            registration.setName("osQueryTrustedHostFilter");
            registration.setEnabled(!properties.getAllowedHosts().isEmpty());
            return registration;
        }

        @Bean
        public FilterRegistrationBean<CorsFilter> osQueryCorsFilter(OsQueryProperties properties) {
            List<String> origins = properties.getAllowedOrigins();

            CorsConfiguration cors = new CorsConfiguration();
            cors.setAllowedOrigins(origins);
            cors.setAllowedMethods(List.of("GET", "POST"));
            cors.addAllowedHeader("*");

            UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
            source.registerCorsConfiguration("/**", cors);

            FilterRegistrationBean<CorsFilter> registration = new FilterRegistrationBean<>(new CorsFilter(source));
            registration.addUrlPatterns("/*");
            registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);
            registration.setName("osQueryCorsFilter");
            registration.setEnabled(!origins.isEmpty());
            if (!origins.isEmpty()) {
                log.info("CORS enabled for origins: {}", origins);
            }
            return registration;
        }
    }
}
