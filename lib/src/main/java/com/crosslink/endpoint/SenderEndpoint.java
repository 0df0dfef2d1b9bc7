package com.crosslink.endpoint;

import com.crosslink.MessageType;
import com.crosslink.pathway.PathwaySender;

import java.util.concurrent.TimeUnit;

/**
 * Type-erased producer end stored in the router's registries.
 * <p>
 * The router verifies a payload against {@link #messageType()} before handing it to
 * one of the erased send methods, so implementations only re-check as a guard.
 */
public interface SenderEndpoint {

    /**
     * Sends, waiting for buffer space.
     *
     * @param message the payload, which must be accepted by {@link #messageType()}
     * @throws InterruptedException if interrupted while waiting
     * @throws com.crosslink.SendFailedException if the consumer end is closed
     */
    void sendErased(Object message) throws InterruptedException;

    /**
     * Sends, waiting at most the given time for buffer space.
     *
     * @return true if enqueued, false on timeout
     */
    boolean sendErased(Object message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Sends only if space is available right now.
     *
     * @return true if enqueued
     */
    boolean trySendErased(Object message);

    MessageType<?> messageType();

    default String messageTypeName() {
        return messageType().name();
    }

    boolean isClosed();

    void close();

    /**
     * Wraps a typed pathway sender for registration.
     */
    static <T> SenderEndpoint of(MessageType<T> messageType, PathwaySender<T> sender) {
        return new TypedSenderEndpoint<>(messageType, sender);
    }
}
