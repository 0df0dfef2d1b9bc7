package com.crosslink.config;

/**
 * Defines the queue implementation backing a pathway.
 *
 * <ul>
 *   <li>{@link #LINKED} - Lock-based bounded buffer, supports capacity 0 (rendezvous)</li>
 *   <li>{@link #MPSC} - Lock-free JCTools MpscArrayQueue for many concurrent senders</li>
 * </ul>
 */
public enum PathwayType {
    /**
     * Bounded buffer guarded by a single lock with not-full / not-empty conditions.
     * Senders and the receiver park while waiting.
     * This is the default and the only type that accepts a capacity of zero.
     */
    LINKED,

    /**
     * JCTools MpscArrayQueue with an exact capacity bound.
     * Enqueue is lock-free; blocked senders spin with adaptive back-off.
     * Best choice when many tasks share one pathway through the router.
     */
    MPSC
}
