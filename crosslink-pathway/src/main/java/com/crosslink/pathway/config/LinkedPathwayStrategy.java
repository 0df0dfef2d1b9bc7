package com.crosslink.pathway.config;

import com.crosslink.config.PathwayConfig;
import com.crosslink.pathway.LinkedPathway;
import com.crosslink.pathway.Pathway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pathway creation strategy producing lock-based {@link LinkedPathway}s.
 */
public class LinkedPathwayStrategy implements PathwayCreationStrategy {
    private static final Logger logger = LoggerFactory.getLogger(LinkedPathwayStrategy.class);

    @Override
    public <T> Pathway<T> createPathway(PathwayConfig config, String name) {
        int capacity = config.getCapacity();
        logger.debug("Creating LinkedPathway '{}' with capacity: {}", name, capacity);
        return new LinkedPathway<>(capacity, name);
    }
}
