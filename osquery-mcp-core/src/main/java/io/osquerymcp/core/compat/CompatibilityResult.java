package io.osquerymcp.core.compat;

/**
 * Outcome of a compatibility check. A rejection is an expected domain result,
 * not a fault, so it is returned rather than thrown.
 *
 * @param compatible true if the tool may run
 * @param reason     Human-readable rejection message, null when compatible
 */
public record CompatibilityResult(boolean compatible, String reason) {

    private static final CompatibilityResult OK = new CompatibilityResult(true, null);

    public static CompatibilityResult ok() {
        return OK;
    }

    public static CompatibilityResult rejected(String reason) {
        return new CompatibilityResult(false, reason);
    }

    public boolean isRejected() {
        return !compatible;
    }
}
