package io.osquerymcp.spring;

import io.osquerymcp.core.registry.ToolDescriptor;
import io.osquerymcp.core.registry.ToolRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists registered tools with their version ranges and HTTP verbs at {@code GET /tools}.
 */
@RestController
public class ToolCatalogController {

    private final ToolRegistry registry;

    public ToolCatalogController(ToolRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/tools")
    public List<Map<String, Object>> tools() {
        return registry.list().stream().map(ToolCatalogController::describe).collect(Collectors.toList());
    }

    static Map<String, Object> describe(ToolDescriptor<?> descriptor) {
        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", descriptor.name());
        tool.put("display_name", descriptor.displayName());
        tool.put("description", descriptor.description());
        tool.put("min_version", descriptor.versionRange().min());
        tool.put("max_version", descriptor.versionRange().max());
        tool.put("http_methods", descriptor.httpMethods().stream().map(Enum::name).collect(Collectors.toList()));
        tool.put("input_schema", descriptor.inputSchema());
        return tool;
    }
}
