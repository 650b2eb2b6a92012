package io.osquerymcp.core.client;

import io.osquerymcp.core.OsQueryException;

/**
 * Thrown when a call to the OpenSearch cluster fails: a network error, a non-2xx
 * status or an unreadable response.
 */
public class UpstreamCallException extends OsQueryException {

    private final int statusCode;

    public UpstreamCallException(String message) {
        this(message, -1);
    }

    public UpstreamCallException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return HTTP status of the failed response, or -1 if no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
