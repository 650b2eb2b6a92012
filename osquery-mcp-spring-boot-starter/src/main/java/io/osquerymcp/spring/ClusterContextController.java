package io.osquerymcp.spring;

import com.fasterxml.jackson.databind.JsonNode;
import io.osquerymcp.core.OsQueryException;
import io.osquerymcp.core.args.ClusterTarget;
import io.osquerymcp.core.cache.ClusterContextCache;
import io.osquerymcp.core.client.UnknownClusterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves the cached index listing of a cluster at {@code GET /cluster/indices}.
 *
 * <p>{@code refresh=true} drops the cluster's cached context first.
 */
@RestController
public class ClusterContextController {

    private static final Logger log = LoggerFactory.getLogger(ClusterContextController.class);

    private final ClusterContextCache cache;

    public ClusterContextController(ClusterContextCache cache) {
        this.cache = cache;
    }

    @GetMapping("/cluster/indices")
    public JsonNode indices(@RequestParam(name = "cluster", required = false) String cluster,
                            @RequestParam(name = "refresh", defaultValue = "false") boolean refresh) {
        ClusterTarget target = new ClusterTarget(cluster);
        if (refresh) {
            cache.invalidate(target);
        }
        return cache.allIndices(target);
    }

    @ExceptionHandler(UnknownClusterException.class)
    public ResponseEntity<Map<String, Object>> unknownCluster(UnknownClusterException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(OsQueryException.class)
    public ResponseEntity<Map<String, Object>> upstreamFailure(OsQueryException e) {
        log.warn("Cannot load cluster indices: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
