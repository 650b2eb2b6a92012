package io.osquerymcp.core.args;

/**
 * A single argument validation failure.
 *
 * @param field   JSON field name (empty for whole-object errors)
 * @param message What is wrong with the value
 */
public record ValidationError(String field, String message) {

    @Override
    public String toString() {
        return field == null || field.isEmpty() ? message : field + ": " + message;
    }
}
