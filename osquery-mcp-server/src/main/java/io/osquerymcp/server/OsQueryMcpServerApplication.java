package io.osquerymcp.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Locale;
import java.util.Map;

/**
 * OpenSearch query MCP server.
 *
 * <h2>Running</h2>
 * <pre>
 * # Stateless HTTP on port 8000 (default)
 * OPENSEARCH_URL=http://localhost:9200 mvn spring-boot:run
 *
 * # stdio, for MCP clients that spawn the server
 * OSQUERYMCP_TRANSPORT=stdio java -jar osquery-mcp-server.jar
 *
 * # SSE
 * OSQUERYMCP_TRANSPORT=sse java -jar osquery-mcp-server.jar
 * </pre>
 */
@SpringBootApplication
public class OsQueryMcpServerApplication {

    private static final Logger log = LoggerFactory.getLogger(OsQueryMcpServerApplication.class);

    static final String TRANSPORT_ENV = "OSQUERYMCP_TRANSPORT";
    static final String TRANSPORT_ARG = "--osquery.transport=";

    public static void main(String[] args) {
        String transport = resolveTransport(args, System.getenv());
        log.info("Starting OpenSearch query MCP server with {} transport...", transport);

        SpringApplication application = new SpringApplication(OsQueryMcpServerApplication.class);
        if ("stdio".equals(transport)) {
            // stdout belongs to the JSON-RPC stream
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        application.run(args);
    }

    /**
     * Transport from the command line, then the environment, defaulting to http.
     */
    static String resolveTransport(String[] args, Map<String, String> env) {
        for (String arg : args) {
            if (arg.startsWith(TRANSPORT_ARG)) {
                return arg.substring(TRANSPORT_ARG.length()).trim().toLowerCase(Locale.ROOT);
            }
        }
        String fromEnv = env.get(TRANSPORT_ENV);
        return fromEnv != null && !fromEnv.isBlank() ? fromEnv.trim().toLowerCase(Locale.ROOT) : "http";
    }
}
