package com.crosslink.config;

/**
 * Configuration for pathway creation.
 */
public class PathwayConfig {
    // Default values for pathway configuration
    public static final int DEFAULT_CAPACITY = 32;
    public static final PathwayType DEFAULT_PATHWAY_TYPE = PathwayType.LINKED;

    private int capacity;
    private PathwayType pathwayType;

    /**
     * Creates a new PathwayConfig with default values.
     */
    public PathwayConfig() {
        this.capacity = DEFAULT_CAPACITY;
        this.pathwayType = DEFAULT_PATHWAY_TYPE;
    }

    /**
     * Creates a new PathwayConfig with the given capacity and the default type.
     *
     * @param capacity The maximum number of buffered messages
     */
    public PathwayConfig(int capacity) {
        this();
        setCapacity(capacity);
    }

    /**
     * Sets the capacity of the pathway.
     *
     * @param capacity The maximum number of buffered messages (0 for a rendezvous pathway)
     * @return This PathwayConfig instance
     * @throws IllegalArgumentException if capacity is negative
     */
    public PathwayConfig setCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Pathway capacity must be >= 0, got: " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    /**
     * Gets the capacity of the pathway.
     *
     * @return The capacity
     */
    public int getCapacity() {
        return capacity;
    }

    /**
     * Sets the pathway type.
     *
     * @param pathwayType The pathway type (LINKED or MPSC)
     * @return This PathwayConfig instance
     */
    public PathwayConfig setPathwayType(PathwayType pathwayType) {
        this.pathwayType = pathwayType != null ? pathwayType : DEFAULT_PATHWAY_TYPE;
        return this;
    }

    /**
     * Gets the pathway type.
     *
     * @return The pathway type
     */
    public PathwayType getPathwayType() {
        return pathwayType;
    }

    /**
     * Returns a copy of this configuration with a different capacity.
     *
     * @param capacity The capacity for the copy
     * @return A new PathwayConfig
     */
    public PathwayConfig withCapacity(int capacity) {
        return new PathwayConfig(capacity).setPathwayType(pathwayType);
    }

    @Override
    public String toString() {
        return "PathwayConfig{capacity=" + capacity + ", pathwayType=" + pathwayType + "}";
    }
}
