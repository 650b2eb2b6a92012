package io.osquerymcp.spring;

import io.osquerymcp.core.registry.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health endpoint for liveness checks and load balancers: {@code GET /health} and {@code HEAD /health}.
 *
 * <p>Reports the server as healthy once tools are registered. It does not contact
 * OpenSearch.
 */
@RestController
public class OsQueryHealthController {

    private final ToolRegistry registry;
    private final OsQueryProperties properties;

    public OsQueryHealthController(ToolRegistry registry, OsQueryProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ready = registry.size() > 0;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "healthy" : "unhealthy");
        body.put("server", properties.advertisedName());
        body.put("tools", registry.size());
        return ResponseEntity.status(ready ? 200 : 503).body(body);
    }

    @RequestMapping(value = "/health", method = RequestMethod.HEAD)
    public ResponseEntity<Void> healthHead() {
        return ResponseEntity.status(registry.size() > 0 ? 200 : 503).build();
    }
}
