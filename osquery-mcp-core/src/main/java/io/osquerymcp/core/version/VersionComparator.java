package io.osquerymcp.core.version;

/**
 * Parses and orders dotted numeric version strings such as {@code "2.12.0"}.
 *
 * <p>Components are compared as integers from left to right. A missing trailing
 * component counts as zero, so {@code "2.12"} and {@code "2.12.0"} are equal.
 * Build qualifiers after the first {@code '-'} or {@code '+'} are ignored
 * ({@code "2.12.0-SNAPSHOT"} orders as {@code "2.12.0"}).
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * VersionComparator.compare("2.11.0", "2.12.0");      // negative
 * VersionComparator.inRange("2.12.0", "2.12.0", null); // true
 * }</pre>
 */
public final class VersionComparator {

    private VersionComparator() {}

    /**
     * Compare two version strings.
     *
     * @param a First version
     * @param b Second version
     * @return negative if {@code a < b}, zero if equal, positive if {@code a > b}
     * @throws VersionParseException if either version is malformed
     */
    public static int compare(String a, String b) {
        int[] left = parse(a);
        int[] right = parse(b);
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            int l = i < left.length ? left[i] : 0;
            int r = i < right.length ? right[i] : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    /**
     * Check whether a version falls inside an inclusive range.
     *
     * @param version The version to test
     * @param min     Inclusive lower bound, or null/blank for none
     * @param max     Inclusive upper bound, or null/blank for none
     * @return true if both present bounds are satisfied
     * @throws VersionParseException if any present version is malformed
     */
    public static boolean inRange(String version, String min, String max) {
        parse(version);
        if (isPresent(min) && compare(version, min) < 0) {
            return false;
        }
        return !isPresent(max) || compare(version, max) <= 0;
    }

    /**
     * Parse a version string into its numeric components.
     *
     * @param version The version string
     * @return Numeric components, never empty
     * @throws VersionParseException if the string is null, blank or has a non-numeric component
     */
    public static int[] parse(String version) {
        if (version == null || version.isBlank()) {
            throw new VersionParseException(version, "version is empty");
        }
        String core = version.trim();
        int qualifier = indexOfQualifier(core);
        if (qualifier >= 0) {
            core = core.substring(0, qualifier);
        }
        String[] parts = core.split("\\.", -1);
        int[] components = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
                throw new VersionParseException(version, "component '" + part + "' is not numeric");
            }
            try {
                components[i] = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw new VersionParseException(version, "component '" + part + "' is out of range");
            }
        }
        return components;
    }

    static boolean isPresent(String bound) {
        return bound != null && !bound.isBlank();
    }

    private static int indexOfQualifier(String version) {
        int dash = version.indexOf('-');
        int plus = version.indexOf('+');
        if (dash < 0) {
            return plus;
        }
        return plus < 0 ? dash : Math.min(dash, plus);
    }
}
