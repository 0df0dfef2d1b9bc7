package com.crosslink;

import java.util.Objects;

/**
 * Runtime tag for a payload type: an explicit discriminant (the name) bound to the Java
 * class that values of this type have.
 * <p>
 * Tags are chosen at registration time and compared on every send and claim, so a
 * receiver registered for {@code MessageType.of(Ping.class)} can only be claimed with an
 * equal tag. Two tags are equal when both name and class are equal.
 *
 * <pre>{@code
 * MessageType<Ping> PING = MessageType.of(Ping.class);
 * MessageType<String> STATUS = MessageType.named("status", String.class);
 * }</pre>
 *
 * @param <T> The payload type
 */
public final class MessageType<T> {

    private final String name;
    private final Class<T> javaType;

    private MessageType(String name, Class<T> javaType) {
        this.name = name;
        this.javaType = javaType;
    }

    /**
     * Creates a tag named after the class's simple name.
     *
     * @param javaType the payload class
     * @param <T> the payload type
     * @return a new tag
     */
    public static <T> MessageType<T> of(Class<T> javaType) {
        Objects.requireNonNull(javaType, "javaType cannot be null");
        String simpleName = javaType.getSimpleName();
        return new MessageType<>(simpleName.isEmpty() ? javaType.getName() : simpleName, javaType);
    }

    /**
     * Creates a tag with an explicit name.
     *
     * @param name the discriminant
     * @param javaType the payload class
     * @param <T> the payload type
     * @return a new tag
     */
    public static <T> MessageType<T> named(String name, Class<T> javaType) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(javaType, "javaType cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Message type name cannot be blank");
        }
        return new MessageType<>(name, javaType);
    }

    public String name() {
        return name;
    }

    public Class<T> javaType() {
        return javaType;
    }

    /**
     * Returns true if the value can travel under this tag.
     *
     * @param message the value to check
     * @return true if message is a non-null instance of the payload class
     */
    public boolean accepts(Object message) {
        return javaType.isInstance(message);
    }

    /**
     * Casts a value that {@link #accepts(Object) is accepted} by this tag.
     *
     * @param message the value
     * @return the value as T
     * @throws ClassCastException if the value is not an instance of the payload class
     */
    public T cast(Object message) {
        return javaType.cast(message);
    }

    /**
     * Returns a readable name for the runtime type of an arbitrary value.
     */
    static String describe(Object message) {
        return message == null ? "null" : message.getClass().getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MessageType)) {
            return false;
        }
        MessageType<?> other = (MessageType<?>) o;
        return name.equals(other.name) && javaType.equals(other.javaType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, javaType);
    }

    @Override
    public String toString() {
        return name.equals(javaType.getSimpleName()) ? name : name + "(" + javaType.getName() + ")";
    }
}
