package io.osquerymcp.core.tools;

import io.osquerymcp.core.args.ArgumentValidationException;
import io.osquerymcp.core.registry.ToolDescriptor;
import io.osquerymcp.core.registry.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Single entry point for invoking tools by name.
 *
 * <p>Looks the tool up, binds its arguments and runs its handler. Every failure
 * becomes an error {@link ToolResult}; only cancellation propagates.
 */
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry registry;
    private final Executor executor;

    public ToolDispatcher(ToolRegistry registry, Executor executor) {
        this.registry = registry;
        this.executor = executor;
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    /**
     * Invoke a tool synchronously on the calling thread.
     *
     * @param toolName     Registered tool name
     * @param rawArguments Arguments as received (may be null)
     * @return Success payload or error payload
     * @throws CancellationException if the invocation was cancelled
     */
    public ToolResult dispatch(String toolName, Map<String, Object> rawArguments) {
        Optional<ToolDescriptor<?>> found = registry.find(toolName);
        if (found.isEmpty()) {
            log.warn("Call to unknown tool: {}", toolName);
            return ToolResult.error("Unknown tool: " + toolName);
        }
        ToolDescriptor<?> descriptor = found.get();

        try {
            return descriptor.invoke(rawArguments);
        } catch (ArgumentValidationException e) {
            log.debug("Rejected arguments for {}: {}", toolName, e.getMessage());
            return ToolResult.error("Invalid arguments for " + descriptor.displayName() + ": " + e.getMessage());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            // handlers translate their own failures; this only catches handler bugs
            log.error("Tool {} failed unexpectedly", toolName, e);
            return ToolResult.error("Error running " + descriptor.displayName() + ": "
                + AbstractToolHandler.messageOf(e));
        }
    }

    /**
     * Invoke a tool on the dispatcher's executor.
     *
     * @param toolName     Registered tool name
     * @param rawArguments Arguments as received (may be null)
     * @return Future completing with the result, or exceptionally on cancellation
     */
    public CompletableFuture<ToolResult> dispatchAsync(String toolName, Map<String, Object> rawArguments) {
        return CompletableFuture.supplyAsync(() -> dispatch(toolName, rawArguments), executor);
    }
}
