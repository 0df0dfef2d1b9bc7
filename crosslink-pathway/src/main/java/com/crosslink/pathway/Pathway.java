package com.crosslink.pathway;

import com.crosslink.config.PathwayType;

/**
 * A bounded FIFO conduit carrying values of one payload type from exactly one
 * producer end to exactly one consumer end.
 * <p>
 * The producer end may be shared by several threads (sends interleave in some total
 * order, each send is all-or-nothing); the consumer end is meant for a single owner.
 * Closing the consumer end makes every subsequent or pending send fail; closing the
 * producer end lets the consumer drain what is buffered and then observe end-of-stream.
 *
 * @param <T> The type of messages carried by this pathway
 */
public interface Pathway<T> {

    /**
     * Returns the producer end of this pathway. Always the same instance.
     *
     * @return the sender
     */
    PathwaySender<T> sender();

    /**
     * Returns the consumer end of this pathway. Always the same instance.
     *
     * @return the receiver
     */
    PathwayReceiver<T> receiver();

    /**
     * Returns the maximum number of buffered messages; 0 for a rendezvous pathway.
     *
     * @return the capacity
     */
    int capacity();

    /**
     * Returns the number of messages currently buffered.
     *
     * @return the number of buffered messages
     */
    int size();

    /**
     * Returns the number of additional messages that can be accepted without blocking.
     *
     * @return the remaining capacity
     */
    default int remainingCapacity() {
        return Math.max(0, capacity() - size());
    }

    /**
     * @return the implementation type of this pathway
     */
    PathwayType pathwayType();

    /**
     * Closes both ends of this pathway.
     */
    default void close() {
        sender().close();
        receiver().close();
    }
}
