package com.crosslink.pathway;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Consumer end of a {@link Pathway}. Owned by a single consumer.
 *
 * @param <T> The type of messages received
 */
public interface PathwayReceiver<T> extends AutoCloseable {

    /**
     * Retrieves and removes the next message, waiting while the pathway is empty.
     *
     * @return the next message, or empty once the producer end is closed and every
     *         buffered message has been received
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> receive() throws InterruptedException;

    /**
     * Retrieves and removes the next message if one is immediately available.
     *
     * @return the next message, or null if none is buffered
     */
    T poll();

    /**
     * Retrieves and removes the next message, waiting up to the specified time.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the next message, or null on timeout or end-of-stream
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Removes up to maxElements buffered messages and adds them to the collection.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * @return the number of buffered messages
     */
    int size();

    /**
     * Returns true once the producer end is closed and nothing is left to receive.
     *
     * @return true at end-of-stream
     */
    boolean isTerminated();

    /**
     * Closes the consumer end. Buffered messages are discarded and pending or future
     * sends fail. Idempotent.
     */
    @Override
    void close();
}
