package com.crosslink.pathway.config;

import com.crosslink.config.PathwayConfig;
import com.crosslink.pathway.Pathway;

/**
 * An interface for providing pathways.
 * Implementations decide which pathway implementation serves a given configuration.
 */
public interface PathwayProvider {

    /**
     * Creates a pathway based on the provided configuration.
     *
     * @param config The pathway configuration (capacity and type); null means defaults
     * @param name The pathway name, used in diagnostics
     * @param <T> The message type
     * @return A {@link Pathway} instance
     */
    <T> Pathway<T> createPathway(PathwayConfig config, String name);
}
