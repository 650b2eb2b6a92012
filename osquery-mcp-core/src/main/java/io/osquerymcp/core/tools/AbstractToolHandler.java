package io.osquerymcp.core.tools;

import io.osquerymcp.core.args.ToolArguments;
import io.osquerymcp.core.client.OpenSearchClient;
import io.osquerymcp.core.compat.CompatibilityGate;
import io.osquerymcp.core.compat.CompatibilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * Base class for handlers that make a single gated call to OpenSearch.
 *
 * <p>Each invocation:
 * <ol>
 *   <li>asks the target cluster for its version</li>
 *   <li>runs the {@link CompatibilityGate} for this handler's tool name</li>
 *   <li>makes exactly one capability call ({@link #call})</li>
 * </ol>
 * Any failure, including a compatibility rejection, becomes
 * {@code "<failureAction>: <message>"}. Cancellation is rethrown.
 *
 * @param <P> Parameter record type
 */
public abstract class AbstractToolHandler<P> implements ToolHandler<P> {

    private static final Logger log = LoggerFactory.getLogger(AbstractToolHandler.class);

    private final String toolName;
    private final String failureAction;
    private final CompatibilityGate gate;
    protected final OpenSearchClient client;

    /**
     * @param toolName      Registry name this handler is gated by
     * @param failureAction Prefix for error messages, e.g. "Error listing indices"
     * @param gate          Compatibility gate
     * @param client        OpenSearch client
     */
    protected AbstractToolHandler(String toolName, String failureAction,
                                  CompatibilityGate gate, OpenSearchClient client) {
        this.toolName = toolName;
        this.failureAction = failureAction;
        this.gate = gate;
        this.client = client;
    }

    public String getToolName() {
        return toolName;
    }

    @Override
    public final ToolResult execute(ToolArguments<P> arguments) {
        try {
            String clusterVersion = client.getClusterVersion(arguments.cluster());
            CompatibilityResult compatibility = gate.check(toolName, clusterVersion);
            if (compatibility.isRejected()) {
                return ToolResult.error(failureAction + ": " + compatibility.reason());
            }

            log.debug("Calling {} on cluster {} (version {})", toolName, arguments.cluster(), clusterVersion);
            return ToolResult.success(call(arguments));
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                CancellationException cancelled = new CancellationException(toolName + " was interrupted");
                cancelled.initCause(e);
                throw cancelled;
            }
            log.warn("{} failed on cluster {}: {}", toolName, arguments.cluster(), e.getMessage());
            return ToolResult.error(failureAction + ": " + messageOf(e));
        }
    }

    /**
     * Make the tool's single capability call.
     *
     * @param arguments Validated arguments
     * @return Payload returned to the caller verbatim
     */
    protected abstract Object call(ToolArguments<P> arguments);

    static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
