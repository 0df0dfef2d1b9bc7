package com.crosslink.pathway.config;

import com.crosslink.config.PathwayConfig;
import com.crosslink.pathway.Pathway;

/**
 * Strategy interface for creating pathways of one implementation type.
 * This allows pathway implementations to be plugged into the provider without
 * modifying the provider's selection logic.
 */
public interface PathwayCreationStrategy {

    /**
     * Creates a pathway according to this strategy.
     *
     * @param config The pathway configuration
     * @param name The pathway name, used in diagnostics
     * @param <T> The message type
     * @return A new pathway instance
     */
    <T> Pathway<T> createPathway(PathwayConfig config, String name);
}
