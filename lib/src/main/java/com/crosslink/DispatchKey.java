package com.crosslink;

import java.util.Objects;

/**
 * Identifies one pathway of a link: the direction from {@code source} to {@code target}.
 * Rendered as {@code {link}/{source}_to_{target}}.
 * <p>
 * The rendering is injective because the separators are reserved: link names may not
 * contain {@code '/'}, endpoint names may contain neither {@code '/'} nor {@code "_to_"},
 * and may neither end with {@code "_to"} nor start with {@code "to_"}. Either affix would
 * form a second {@code "_to_"} across the separator, so that {@code (a, to_b)} and
 * {@code (a_to, b)} both rendered as {@code a_to_to_b}.
 *
 * @param link the link name
 * @param source the sending endpoint
 * @param target the receiving endpoint
 */
public record DispatchKey(String link, String source, String target) {

    static final String LINK_SEPARATOR = "/";
    static final String DIRECTION_SEPARATOR = "_to_";
    static final String RESERVED_SUFFIX = "_to";
    static final String RESERVED_PREFIX = "to_";

    public DispatchKey {
        validateLinkName(link);
        validateEndpointName(source);
        validateEndpointName(target);
        if (source.equals(target)) {
            throw new IllegalArgumentException("Source and target of a pathway must differ: " + source);
        }
    }

    public static DispatchKey of(String link, String source, String target) {
        return new DispatchKey(link, source, target);
    }

    /**
     * @return the key for the opposite direction of the same link
     */
    public DispatchKey reverse() {
        return new DispatchKey(link, target, source);
    }

    /**
     * @return the string form used as a registry key and in diagnostics
     */
    public String asString() {
        return link + LINK_SEPARATOR + source + DIRECTION_SEPARATOR + target;
    }

    @Override
    public String toString() {
        return asString();
    }

    /**
     * Checks that a link name can take part in a dispatch key.
     *
     * @param link the link name
     * @throws IllegalArgumentException if blank or containing '/'
     */
    public static void validateLinkName(String link) {
        Objects.requireNonNull(link, "link cannot be null");
        if (link.isBlank()) {
            throw new IllegalArgumentException("Link name cannot be blank");
        }
        if (link.contains(LINK_SEPARATOR)) {
            throw new IllegalArgumentException("Link name may not contain '" + LINK_SEPARATOR + "': " + link);
        }
    }

    /**
     * Checks that an endpoint name can take part in a dispatch key.
     *
     * @param endpoint the endpoint name
     * @throws IllegalArgumentException if blank, containing a reserved separator, or
     *         ending or starting with a fragment of the direction separator
     */
    public static void validateEndpointName(String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        if (endpoint.isBlank()) {
            throw new IllegalArgumentException("Endpoint name cannot be blank");
        }
        if (endpoint.contains(LINK_SEPARATOR) || endpoint.contains(DIRECTION_SEPARATOR)) {
            throw new IllegalArgumentException("Endpoint name may contain neither '" + LINK_SEPARATOR
                    + "' nor '" + DIRECTION_SEPARATOR + "': " + endpoint);
        }
        if (endpoint.endsWith(RESERVED_SUFFIX) || endpoint.startsWith(RESERVED_PREFIX)) {
            throw new IllegalArgumentException("Endpoint name may neither end with '" + RESERVED_SUFFIX
                    + "' nor start with '" + RESERVED_PREFIX + "': " + endpoint);
        }
    }
}
