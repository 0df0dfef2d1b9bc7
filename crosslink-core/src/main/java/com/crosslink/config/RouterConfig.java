package com.crosslink.config;

/**
 * Configuration for the dispatch router.
 */
public class RouterConfig {
    public static final boolean DEFAULT_DIRECTION_QUALIFIED_DISPATCH = false;
    public static final String DEFAULT_NAME = "router";

    private boolean directionQualifiedDispatch = DEFAULT_DIRECTION_QUALIFIED_DISPATCH;
    private String name = DEFAULT_NAME;

    /**
     * Creates a new RouterConfig with default settings.
     */
    public RouterConfig() {
        // Use defaults
    }

    /**
     * Controls how link-addressed message types map to pathways.
     * <p>
     * When false (the default) a message type may be mapped at most once per link, so
     * the payload type alone selects the direction. When true the mapping is keyed by
     * (link, source endpoint, type): the same type may travel both directions of a link,
     * and sends of such a type must name their source endpoint.
     *
     * @param directionQualifiedDispatch whether to qualify type mappings by source endpoint
     * @return This RouterConfig instance for method chaining
     */
    public RouterConfig setDirectionQualifiedDispatch(boolean directionQualifiedDispatch) {
        this.directionQualifiedDispatch = directionQualifiedDispatch;
        return this;
    }

    public boolean isDirectionQualifiedDispatch() {
        return directionQualifiedDispatch;
    }

    /**
     * Sets the name used in log output for this router.
     *
     * @param name The router name
     * @return This RouterConfig instance for method chaining
     */
    public RouterConfig setName(String name) {
        this.name = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
        return this;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "RouterConfig{name=" + name + ", directionQualifiedDispatch=" + directionQualifiedDispatch + "}";
    }
}
