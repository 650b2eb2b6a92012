package io.osquerymcp.core.tools;

/**
 * Result of one tool invocation: either the capability's payload, passed through
 * verbatim, or an {@link ErrorPayload}.
 *
 * @param content Success payload (JsonNode, list of names, ...) or an ErrorPayload
 * @param error   true if {@code content} is an ErrorPayload
 */
public record ToolResult(Object content, boolean error) {

    public static ToolResult success(Object content) {
        return new ToolResult(content, false);
    }

    public static ToolResult error(String message) {
        return new ToolResult(ErrorPayload.text(message), true);
    }

    /**
     * @return The error payload
     * @throws IllegalStateException if this is a success result
     */
    public ErrorPayload errorPayload() {
        if (!error) {
            throw new IllegalStateException("Tool result is not an error");
        }
        return (ErrorPayload) content;
    }
}
