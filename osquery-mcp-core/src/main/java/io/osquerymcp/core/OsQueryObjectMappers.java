package io.osquerymcp.core;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central factory for ObjectMapper instances used by the tool layer.
 *
 * <p>Spring-managed beans should prefer the application's ObjectMapper; this
 * factory covers static fields and non-Spring code.
 */
public final class OsQueryObjectMappers {

    private OsQueryObjectMappers() {}

    /**
     * Create a new ObjectMapper with default settings.
     *
     * @return a new ObjectMapper instance
     */
    public static ObjectMapper create() {
        return new ObjectMapper();
    }
}
