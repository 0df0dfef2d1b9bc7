package com.crosslink;

import java.util.Objects;

/**
 * Typed identity of one side of one pathway. The router keys registrations by
 * {@link #name()}; the message type travels with the identity so that sends and claims
 * through an {@code EndpointId<T>} are checked at compile time as well as at runtime.
 * <p>
 * Sender and receiver registrations live in separate namespaces: the same name may
 * identify the sending side of one pathway and the receiving side of another.
 *
 * @param name the registry key
 * @param messageType the payload type of the pathway
 * @param <T> the payload type
 */
public record EndpointId<T>(String name, MessageType<T> messageType) {

    public EndpointId {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(messageType, "messageType cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Endpoint identity cannot be blank");
        }
    }

    public static <T> EndpointId<T> of(String name, MessageType<T> messageType) {
        return new EndpointId<>(name, messageType);
    }

    public static <T> EndpointId<T> of(String name, Class<T> javaType) {
        return new EndpointId<>(name, MessageType.of(javaType));
    }

    @Override
    public String toString() {
        return name + "<" + messageType + ">";
    }
}
