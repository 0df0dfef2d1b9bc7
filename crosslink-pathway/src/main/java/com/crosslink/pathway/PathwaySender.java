package com.crosslink.pathway;

import java.util.concurrent.TimeUnit;

/**
 * Producer end of a {@link Pathway}.
 *
 * @param <T> The type of messages sent
 */
public interface PathwaySender<T> {

    /**
     * Enqueues the message, waiting if necessary for space to become available.
     * If the calling thread is interrupted while waiting, the message is not enqueued.
     *
     * @param message the message to send
     * @throws InterruptedException if interrupted while waiting
     * @throws com.crosslink.SendFailedException if the consumer end is or becomes closed
     * @throws NullPointerException if message is null
     */
    void send(T message) throws InterruptedException;

    /**
     * Enqueues the message, waiting up to the specified time for space to become available.
     *
     * @param message the message to send
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return true if the message was accepted, false if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     * @throws com.crosslink.SendFailedException if the consumer end is or becomes closed
     */
    boolean send(T message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Enqueues the message only if it can be accepted immediately.
     *
     * @param message the message to send
     * @return true if the message was accepted, false if the pathway is full
     * @throws com.crosslink.SendFailedException if the consumer end is closed
     */
    boolean trySend(T message);

    /**
     * Returns true once the consumer end has been closed, after which every send fails.
     * Closing this end does not make it report closed.
     *
     * @return true if the peer has gone away
     */
    boolean isClosed();

    /**
     * Closes the producer end. The consumer drains buffered messages and then observes
     * end-of-stream. Idempotent.
     */
    void close();

    /**
     * @return the capacity of the underlying pathway
     */
    int capacity();
}
