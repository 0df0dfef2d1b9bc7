package com.crosslink.link;

import com.crosslink.AmbiguousDispatchException;
import com.crosslink.DispatchKey;
import com.crosslink.DuplicateRegistrationException;
import com.crosslink.EndpointId;
import com.crosslink.MessageType;
import com.crosslink.Router;
import com.crosslink.config.PathwayConfig;
import com.crosslink.config.PathwayType;
import com.crosslink.config.RouterConfig;
import com.crosslink.endpoint.ReceiverSlot;
import com.crosslink.pathway.Pathway;
import com.crosslink.pathway.config.DefaultPathwayProvider;
import com.crosslink.pathway.config.PathwayProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a sealed {@link Router} from a list of {@link LinkSpec} declarations.
 * <p>
 * {@link #build()} validates every declaration before the first pathway is created, so a
 * wiring mistake never leaves a half-built router behind.
 */
public class CrosslinkBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CrosslinkBuilder.class);

    private final List<LinkSpec> specs = new ArrayList<>();
    private final Map<String, Integer> capacityOverrides = new HashMap<>();
    private PathwayProvider pathwayProvider = new DefaultPathwayProvider();
    private RouterConfig routerConfig = new RouterConfig();
    private PathwayConfig defaultPathwayConfig = new PathwayConfig();

    /**
     * Sets the provider that creates the pathway for each direction of each link.
     *
     * @param pathwayProvider The pathway provider
     * @return This builder for method chaining
     */
    public CrosslinkBuilder withPathwayProvider(PathwayProvider pathwayProvider) {
        this.pathwayProvider = Objects.requireNonNull(pathwayProvider, "pathwayProvider cannot be null");
        return this;
    }

    public CrosslinkBuilder withRouterConfig(RouterConfig routerConfig) {
        this.routerConfig = Objects.requireNonNull(routerConfig, "routerConfig cannot be null");
        return this;
    }

    /**
     * Sets the capacity used by links that declare none.
     *
     * @param capacity The default capacity, at least 0
     * @return This builder for method chaining
     */
    public CrosslinkBuilder withDefaultCapacity(int capacity) {
        this.defaultPathwayConfig = defaultPathwayConfig.withCapacity(capacity);
        return this;
    }

    /**
     * Sets the pathway implementation used by links that declare none.
     *
     * @param pathwayType The default pathway type
     * @return This builder for method chaining
     */
    public CrosslinkBuilder withDefaultPathwayType(PathwayType pathwayType) {
        this.defaultPathwayConfig = new PathwayConfig(defaultPathwayConfig.getCapacity()).setPathwayType(pathwayType);
        return this;
    }

    /**
     * Overrides the capacity of one link, taking precedence over the capacity in its spec.
     *
     * @param link The link name
     * @param capacity The capacity, at least 0
     * @return This builder for method chaining
     */
    public CrosslinkBuilder withCapacityOverride(String link, int capacity) {
        Objects.requireNonNull(link, "link cannot be null");
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity override for '" + link + "' must be >= 0, got: " + capacity);
        }
        capacityOverrides.put(link, capacity);
        return this;
    }

    public CrosslinkBuilder link(LinkSpec spec) {
        specs.add(Objects.requireNonNull(spec, "spec cannot be null"));
        return this;
    }

    public CrosslinkBuilder links(Collection<LinkSpec> specs) {
        specs.forEach(this::link);
        return this;
    }

    /**
     * Validates the declarations, creates and registers every pathway, and seals the router.
     *
     * @return the built crosslink
     * @throws DuplicateRegistrationException if two links share a name, or two
     *         endpoint-addressed links register the same identity
     * @throws AmbiguousDispatchException if a link-addressed link carries the same type in
     *         both directions and direction-qualified dispatch is off
     * @throws IllegalArgumentException if a capacity override names an unknown link
     */
    public Crosslink build() {
        validate();

        Router router = new Router(routerConfig);
        Map<String, LinkSpec> byName = new LinkedHashMap<>();
        try {
            for (LinkSpec spec : specs) {
                PathwayConfig config = pathwayConfigFor(spec);
                for (LinkSpec.Direction direction : spec.directions()) {
                    wire(router, spec, direction, direction.messageType(), config);
                }
                byName.put(spec.name(), spec);
            }
        } catch (RuntimeException e) {
            router.close();
            throw e;
        }
        router.seal();
        logger.info("Built crosslink '{}' with {} link(s)", routerConfig.getName(), byName.size());
        return new Crosslink(router, byName);
    }

    private void validate() {
        Set<String> linkNames = new HashSet<>();
        Set<String> senderIdentities = new HashSet<>();
        Set<String> receiverIdentities = new HashSet<>();

        for (LinkSpec spec : specs) {
            if (!linkNames.add(spec.name())) {
                throw new DuplicateRegistrationException("Link '" + spec.name() + "' is declared more than once",
                        spec.name());
            }
            if (spec.addressing() == LinkSpec.Addressing.ENDPOINT) {
                for (LinkSpec.Direction direction : spec.directions()) {
                    if (!senderIdentities.add(direction.source())) {
                        throw new DuplicateRegistrationException("Endpoint '" + direction.source()
                                + "' sends on more than one endpoint-addressed link", direction.source());
                    }
                    if (!receiverIdentities.add(direction.target())) {
                        throw new DuplicateRegistrationException("Endpoint '" + direction.target()
                                + "' receives on more than one endpoint-addressed link", direction.target());
                    }
                }
            } else if (spec.isBidirectional() && !routerConfig.isDirectionQualifiedDispatch()) {
                MessageType<?> forward = spec.directions().get(0).messageType();
                MessageType<?> backward = spec.directions().get(1).messageType();
                if (forward.javaType().equals(backward.javaType())) {
                    throw new AmbiguousDispatchException("Link '" + spec.name() + "' carries " + forward
                            + " in both directions; enable direction-qualified dispatch or use distinct types",
                            spec.name());
                }
            }
        }

        for (String link : capacityOverrides.keySet()) {
            if (!linkNames.contains(link)) {
                throw new IllegalArgumentException("Capacity override names unknown link '" + link + "'");
            }
        }
    }

    private PathwayConfig pathwayConfigFor(LinkSpec spec) {
        int capacity = capacityOverrides.containsKey(spec.name())
                ? capacityOverrides.get(spec.name())
                : spec.capacity().orElse(defaultPathwayConfig.getCapacity());
        PathwayType type = spec.pathwayType().orElse(defaultPathwayConfig.getPathwayType());
        return new PathwayConfig(capacity).setPathwayType(type);
    }

    private <T> void wire(Router router, LinkSpec spec, LinkSpec.Direction direction,
                          MessageType<T> messageType, PathwayConfig config) {
        DispatchKey key = spec.keyOf(direction);
        Pathway<T> pathway = pathwayProvider.createPathway(config, key.asString());

        if (spec.addressing() == LinkSpec.Addressing.ENDPOINT) {
            router.registerSender(EndpointId.of(direction.source(), messageType), pathway.sender());
            router.registerReceiver(EndpointId.of(direction.target(), messageType), pathway.receiver());
        } else {
            router.registerPathway(key.link(), key.source(), key.target(), messageType, pathway.sender());
            router.registerReceiver(key.asString(), new ReceiverSlot<>(messageType, pathway.receiver()));
        }
        logger.debug("Wired {} as {} with {}", key, pathway, config);
    }
}
