package com.crosslink.link;

import com.crosslink.DispatchKey;
import com.crosslink.MessageType;
import com.crosslink.config.PathwayType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Declaration of one link between two named endpoints.
 * <p>
 * A bidirectional link has one pathway per direction, each carrying the type its source
 * endpoint sends. A unidirectional link has a single pathway.
 *
 * <pre>{@code
 * LinkSpec exchange = LinkSpec.bidirectional("Exchange")
 *         .endpoint("Pinger", MessageType.of(Ping.class))
 *         .endpoint("Ponger", MessageType.of(Pong.class))
 *         .capacity(8)
 *         .build();
 *
 * LinkSpec monitor = LinkSpec.unidirectional("Monitor")
 *         .endpoint("Probe", MessageType.of(Status.class))
 *         .endpoint("Dashboard")
 *         .build();
 * }</pre>
 */
public final class LinkSpec {

    /**
     * How the pathways of a link are registered with the router.
     */
    public enum Addressing {
        /**
         * Pathways are registered under the link and mapped by message type; senders use
         * link-addressed sends and receivers are registered under the dispatch key.
         */
        LINK,

        /**
         * Each sender is registered under its source endpoint's name and each receiver
         * under its target endpoint's name.
         */
        ENDPOINT
    }

    /**
     * One pathway of the link.
     *
     * @param source the sending endpoint
     * @param target the receiving endpoint
     * @param messageType the type the source sends
     */
    public record Direction(String source, String target, MessageType<?> messageType) {
    }

    private final String name;
    private final List<String> endpoints;
    private final List<Direction> directions;
    private final Integer capacity;
    private final PathwayType pathwayType;
    private final Addressing addressing;

    private LinkSpec(Builder builder, List<Direction> directions) {
        this.name = builder.name;
        this.endpoints = List.copyOf(builder.endpointNames);
        this.directions = List.copyOf(directions);
        this.capacity = builder.capacity;
        this.pathwayType = builder.pathwayType;
        this.addressing = builder.addressing;
    }

    public static Builder bidirectional(String name) {
        return new Builder(name, true);
    }

    public static Builder unidirectional(String name) {
        return new Builder(name, false);
    }

    public String name() {
        return name;
    }

    public List<String> endpoints() {
        return endpoints;
    }

    public List<Direction> directions() {
        return directions;
    }

    public boolean isBidirectional() {
        return directions.size() == 2;
    }

    /**
     * @return the capacity declared on this link, if any
     */
    public OptionalInt capacity() {
        return capacity == null ? OptionalInt.empty() : OptionalInt.of(capacity);
    }

    public Optional<PathwayType> pathwayType() {
        return Optional.ofNullable(pathwayType);
    }

    public Addressing addressing() {
        return addressing;
    }

    public boolean hasEndpoint(String endpoint) {
        return endpoints.contains(endpoint);
    }

    /**
     * @return the direction in which the endpoint sends, if it sends on this link
     */
    public Optional<Direction> outbound(String endpoint) {
        return directions.stream().filter(d -> d.source().equals(endpoint)).findFirst();
    }

    /**
     * @return the direction in which the endpoint receives, if it receives on this link
     */
    public Optional<Direction> inbound(String endpoint) {
        return directions.stream().filter(d -> d.target().equals(endpoint)).findFirst();
    }

    public DispatchKey keyOf(Direction direction) {
        return new DispatchKey(name, direction.source(), direction.target());
    }

    /**
     * @return the router identity under which the direction's producer end is registered
     */
    public String senderIdentity(Direction direction) {
        return addressing == Addressing.ENDPOINT ? direction.source() : keyOf(direction).asString();
    }

    /**
     * @return the router identity under which the direction's consumer end is registered
     */
    public String receiverIdentity(Direction direction) {
        return addressing == Addressing.ENDPOINT ? direction.target() : keyOf(direction).asString();
    }

    @Override
    public String toString() {
        return "LinkSpec{" + name + ", " + directions + ", addressing=" + addressing
                + (capacity == null ? "" : ", capacity=" + capacity) + "}";
    }

    /**
     * Fluent builder for a {@link LinkSpec}.
     */
    public static final class Builder {

        private final String name;
        private final boolean bidirectional;
        private final List<String> endpointNames = new ArrayList<>(2);
        private final List<MessageType<?>> endpointSends = new ArrayList<>(2);
        private Integer capacity;
        private PathwayType pathwayType;
        private Addressing addressing = Addressing.LINK;

        private Builder(String name, boolean bidirectional) {
            this.name = name;
            this.bidirectional = bidirectional;
        }

        /**
         * Adds an endpoint that sends the given type on this link.
         *
         * @param endpoint the endpoint name
         * @param sends the type the endpoint sends
         * @return This builder for method chaining
         */
        public Builder endpoint(String endpoint, MessageType<?> sends) {
            Objects.requireNonNull(sends, "sends cannot be null");
            return addEndpoint(endpoint, sends);
        }

        /**
         * Adds the receive-only endpoint of a unidirectional link.
         *
         * @param endpoint the endpoint name
         * @return This builder for method chaining
         */
        public Builder endpoint(String endpoint) {
            return addEndpoint(endpoint, null);
        }

        private Builder addEndpoint(String endpoint, MessageType<?> sends) {
            if (endpointNames.size() == 2) {
                throw new IllegalArgumentException("Link '" + name + "' already has two endpoints");
            }
            endpointNames.add(endpoint);
            endpointSends.add(sends);
            return this;
        }

        /**
         * Sets the buffer capacity of each pathway of this link; 0 requests rendezvous.
         * When unset, the builder's default applies.
         *
         * @param capacity the capacity, at least 0
         * @return This builder for method chaining
         */
        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder pathwayType(PathwayType pathwayType) {
            this.pathwayType = pathwayType;
            return this;
        }

        public Builder addressing(Addressing addressing) {
            this.addressing = Objects.requireNonNull(addressing, "addressing cannot be null");
            return this;
        }

        /**
         * Validates the declaration and creates the spec.
         *
         * @throws IllegalArgumentException if a name is malformed, the endpoints are not two
         *         distinct names, the sending endpoints do not match the link's direction or
         *         the capacity is negative
         */
        public LinkSpec build() {
            DispatchKey.validateLinkName(name);
            if (endpointNames.size() != 2) {
                throw new IllegalArgumentException("Link '" + name + "' needs exactly two endpoints, got "
                        + endpointNames.size());
            }
            endpointNames.forEach(DispatchKey::validateEndpointName);
            String first = endpointNames.get(0);
            String second = endpointNames.get(1);
            if (first.equals(second)) {
                throw new IllegalArgumentException("Link '" + name + "' connects endpoint '" + first + "' to itself");
            }
            if (capacity != null && capacity < 0) {
                throw new IllegalArgumentException("Capacity of link '" + name + "' must be >= 0, got: " + capacity);
            }

            MessageType<?> firstSends = endpointSends.get(0);
            MessageType<?> secondSends = endpointSends.get(1);
            List<Direction> directions = new ArrayList<>(2);
            if (bidirectional) {
                if (firstSends == null || secondSends == null) {
                    throw new IllegalArgumentException(
                            "Both endpoints of bidirectional link '" + name + "' must declare the type they send");
                }
                directions.add(new Direction(first, second, firstSends));
                directions.add(new Direction(second, first, secondSends));
            } else {
                if ((firstSends == null) == (secondSends == null)) {
                    throw new IllegalArgumentException(
                            "Exactly one endpoint of unidirectional link '" + name + "' must send");
                }
                directions.add(firstSends != null
                        ? new Direction(first, second, firstSends)
                        : new Direction(second, first, secondSends));
            }
            return new LinkSpec(this, directions);
        }
    }
}
