package io.osquerymcp.core.tools;

/**
 * Uniform error shape returned instead of a raw exception:
 * {@code {"type": "text", "text": "..."}}.
 *
 * @param type Always {@code "text"}
 * @param text Error message
 */
public record ErrorPayload(String type, String text) {

    public static final String TEXT = "text";

    public static ErrorPayload text(String message) {
        return new ErrorPayload(TEXT, message);
    }
}
