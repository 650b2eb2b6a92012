package io.osquerymcp.core.registry;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * HTTP verbs a tool's underlying OpenSearch call may use.
 *
 * <p>Advertised as documentation metadata only; transports do not route on it.
 */
public enum HttpVerb {
    GET,
    POST,
    PUT,
    DELETE,
    HEAD,
    PATCH;

    /**
     * Resolve a verb name, ignoring case and surrounding whitespace.
     *
     * @param name Verb name such as "delete"
     * @return The verb, or empty if unknown
     */
    public static Optional<HttpVerb> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(v -> v.name().equals(normalized)).findFirst();
    }

    public static Set<HttpVerb> of(HttpVerb first, HttpVerb... rest) {
        return EnumSet.of(first, rest);
    }

    public static Set<HttpVerb> all() {
        return EnumSet.allOf(HttpVerb.class);
    }

    /**
     * Render a verb set as a comma-separated list, e.g. {@code "GET, POST"}.
     */
    public static String join(Set<HttpVerb> verbs) {
        return verbs.stream().map(Enum::name).collect(Collectors.joining(", "));
    }
}
