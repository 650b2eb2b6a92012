package io.osquerymcp.core.version;

/**
 * Inclusive range of cluster versions a tool supports. Either bound may be absent.
 *
 * <p>Fixed when the tool is registered and never changed afterwards.
 *
 * @param min Inclusive lower bound, or null
 * @param max Inclusive upper bound, or null
 */
public record VersionRange(String min, String max) {

    private static final VersionRange UNBOUNDED = new VersionRange(null, null);

    public VersionRange {
        min = VersionComparator.isPresent(min) ? min.trim() : null;
        max = VersionComparator.isPresent(max) ? max.trim() : null;
        if (min != null && max != null && VersionComparator.compare(min, max) > 0) {
            throw new IllegalArgumentException(
                "Version range lower bound " + min + " is greater than upper bound " + max);
        }
        if (min != null) {
            VersionComparator.parse(min);
        }
        if (max != null) {
            VersionComparator.parse(max);
        }
    }

    public static VersionRange unbounded() {
        return UNBOUNDED;
    }

    public static VersionRange atLeast(String min) {
        return new VersionRange(min, null);
    }

    public static VersionRange atMost(String max) {
        return new VersionRange(null, max);
    }

    public static VersionRange between(String min, String max) {
        return new VersionRange(min, max);
    }

    /**
     * @return true if neither bound is set
     */
    public boolean isUnbounded() {
        return min == null && max == null;
    }

    /**
     * Check whether a version lies in this range, bounds included.
     *
     * @throws VersionParseException if the version is malformed
     */
    public boolean contains(String version) {
        return VersionComparator.inRange(version, min, max);
    }

    /**
     * Human-readable form used in compatibility messages.
     *
     * @return {@code "<min> to <max>"}, {@code "<min> or later"}, {@code "up to <max>"},
     *         or null when unbounded
     */
    public String describe() {
        if (min != null && max != null) {
            return min + " to " + max;
        }
        if (min != null) {
            return min + " or later";
        }
        if (max != null) {
            return "up to " + max;
        }
        return null;
    }
}
