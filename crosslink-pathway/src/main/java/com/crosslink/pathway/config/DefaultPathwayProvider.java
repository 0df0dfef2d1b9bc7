package com.crosslink.pathway.config;

import com.crosslink.config.PathwayConfig;
import com.crosslink.config.PathwayType;
import com.crosslink.pathway.Pathway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default pathway provider that selects a creation strategy by {@link PathwayType}.
 *
 * - LINKED: LinkedPathway (lock-based, supports rendezvous)
 * - MPSC: MpscPathway (lock-free enqueue for many senders)
 */
public class DefaultPathwayProvider implements PathwayProvider {
    private static final Logger logger = LoggerFactory.getLogger(DefaultPathwayProvider.class);

    private final Map<PathwayType, PathwayCreationStrategy> strategies;
    private final PathwayCreationStrategy defaultStrategy;

    public DefaultPathwayProvider() {
        this.strategies = new EnumMap<>(PathwayType.class);
        this.defaultStrategy = new LinkedPathwayStrategy();
        this.strategies.put(PathwayType.LINKED, defaultStrategy);
        this.strategies.put(PathwayType.MPSC, new MpscPathwayStrategy());
    }

    /**
     * Replaces the strategy used for one pathway type.
     *
     * @param type The pathway type
     * @param strategy The strategy to use for it
     * @return This provider for method chaining
     */
    public DefaultPathwayProvider withStrategy(PathwayType type, PathwayCreationStrategy strategy) {
        strategies.put(type, strategy);
        return this;
    }

    @Override
    public <T> Pathway<T> createPathway(PathwayConfig config, String name) {
        PathwayConfig effectiveConfig = (config != null) ? config : new PathwayConfig();

        logger.debug("DefaultPathwayProvider creating pathway '{}' - config: {}", name, effectiveConfig);

        PathwayCreationStrategy strategy = strategies.getOrDefault(effectiveConfig.getPathwayType(), defaultStrategy);
        return strategy.createPathway(effectiveConfig, name);
    }
}
