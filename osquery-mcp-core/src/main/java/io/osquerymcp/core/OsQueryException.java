package io.osquerymcp.core;

/**
 * Base exception for failures raised by the tool registry and dispatch layer.
 */
public class OsQueryException extends RuntimeException {

    public OsQueryException(String message) {
        super(message);
    }

    public OsQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
