package com.crosslink.pathway.config;

import com.crosslink.config.PathwayConfig;
import com.crosslink.pathway.LinkedPathway;
import com.crosslink.pathway.MpscPathway;
import com.crosslink.pathway.Pathway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pathway creation strategy producing lock-free {@link MpscPathway}s.
 * A rendezvous request (capacity 0) cannot be served by an MPSC queue and falls back
 * to a {@link LinkedPathway}.
 */
public class MpscPathwayStrategy implements PathwayCreationStrategy {
    private static final Logger logger = LoggerFactory.getLogger(MpscPathwayStrategy.class);

    @Override
    public <T> Pathway<T> createPathway(PathwayConfig config, String name) {
        int capacity = config.getCapacity();
        if (capacity == 0) {
            logger.warn("MPSC pathway '{}' requested with capacity 0; using a rendezvous LinkedPathway instead", name);
            return new LinkedPathway<>(0, name);
        }
        logger.debug("Creating MpscPathway '{}' with capacity: {}", name, capacity);
        return new MpscPathway<>(capacity, name);
    }
}
