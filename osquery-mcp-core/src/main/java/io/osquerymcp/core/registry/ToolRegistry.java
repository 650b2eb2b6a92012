package io.osquerymcp.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of tool descriptors keyed by tool name.
 *
 * <p>Populated once at startup and read concurrently afterwards. Registration
 * publishes a new immutable snapshot (copy-on-write), so lookups never lock.
 * Listing preserves insertion order.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private volatile Map<String, ToolDescriptor<?>> tools = Collections.emptyMap();

    /**
     * Register a tool.
     *
     * @param descriptor The descriptor to add
     * @throws DuplicateToolException if the name is already registered; the existing entry is kept
     */
    public synchronized void register(ToolDescriptor<?> descriptor) {
        if (tools.containsKey(descriptor.name())) {
            throw new DuplicateToolException(descriptor.name());
        }
        Map<String, ToolDescriptor<?>> next = new LinkedHashMap<>(tools);
        next.put(descriptor.name(), descriptor);
        tools = Collections.unmodifiableMap(next);

        log.debug("Registered tool: {} (range: {}, methods: {})",
            descriptor.name(),
            descriptor.versionRange().isUnbounded() ? "any" : descriptor.versionRange().describe(),
            HttpVerb.join(descriptor.httpMethods()));
    }

    /**
     * Get a tool by name.
     *
     * @param name The tool name
     * @return The descriptor
     * @throws UnknownToolException if no tool has this name
     */
    public ToolDescriptor<?> get(String name) {
        ToolDescriptor<?> descriptor = tools.get(name);
        if (descriptor == null) {
            throw new UnknownToolException(name);
        }
        return descriptor;
    }

    public Optional<ToolDescriptor<?>> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * @return All descriptors in registration order
     */
    public List<ToolDescriptor<?>> list() {
        return List.copyOf(tools.values());
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public int size() {
        return tools.size();
    }
}
