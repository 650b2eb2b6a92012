package io.osquerymcp.core.tools;

import io.osquerymcp.core.args.ToolArguments;

/**
 * Executes one tool.
 *
 * <p>Implementations never let an exception escape, with one exception:
 * {@link java.util.concurrent.CancellationException} propagates untranslated.
 *
 * @param <P> Parameter record type
 */
@FunctionalInterface
public interface ToolHandler<P> {

    /**
     * @param arguments Validated arguments
     * @return Success payload or uniform error payload
     */
    ToolResult execute(ToolArguments<P> arguments);
}
