package io.osquerymcp.core.version;

import io.osquerymcp.core.OsQueryException;

/**
 * Thrown when a version string is not a dotted sequence of non-negative integers.
 */
public class VersionParseException extends OsQueryException {

    private final String version;

    public VersionParseException(String version, String reason) {
        super(String.format("Invalid version '%s': %s", version, reason));
        this.version = version;
    }

    /**
     * Get the version string that failed to parse.
     *
     * @return The raw version string (may be null)
     */
    public String getVersion() {
        return version;
    }
}
