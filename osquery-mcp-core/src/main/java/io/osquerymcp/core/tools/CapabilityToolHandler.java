package io.osquerymcp.core.tools;

import io.osquerymcp.core.args.ToolArguments;
import io.osquerymcp.core.client.OpenSearchClient;
import io.osquerymcp.core.compat.CompatibilityGate;

/**
 * Handler whose capability call is a plain pass-through to one
 * {@link OpenSearchClient} method.
 *
 * @param <P> Parameter record type
 */
public class CapabilityToolHandler<P> extends AbstractToolHandler<P> {

    /**
     * The client call a capability makes.
     */
    @FunctionalInterface
    public interface CapabilityCall<P> {
        Object call(OpenSearchClient client, ToolArguments<P> arguments);
    }

    private final CapabilityCall<P> capability;

    public CapabilityToolHandler(String toolName, String failureAction, CompatibilityGate gate,
                                 OpenSearchClient client, CapabilityCall<P> capability) {
        super(toolName, failureAction, gate, client);
        this.capability = capability;
    }

    @Override
    protected Object call(ToolArguments<P> arguments) {
        return capability.call(client, arguments);
    }
}
