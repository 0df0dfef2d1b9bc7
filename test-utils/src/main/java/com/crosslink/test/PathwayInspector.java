package com.crosslink.test;

import com.crosslink.config.PathwayType;
import com.crosslink.pathway.Pathway;

import java.time.Duration;
import java.util.Objects;

/**
 * Inspector for examining pathway occupancy during testing, e.g. to observe back-pressure.
 *
 * <p>Usage:
 * <pre>{@code
 * PathwayInspector inspector = PathwayInspector.create(pathway);
 *
 * sender.trySend(message);
 *
 * assertEquals(1, inspector.size());
 * assertTrue(inspector.awaitEmpty(Duration.ofSeconds(1)));
 * }</pre>
 */
public class PathwayInspector {

    private static final long POLL_INTERVAL_MS = 10;

    private final Pathway<?> pathway;

    private PathwayInspector(Pathway<?> pathway) {
        this.pathway = pathway;
    }

    /**
     * Creates a PathwayInspector for the given pathway.
     *
     * @param pathway the pathway to inspect
     * @return a PathwayInspector instance
     */
    public static PathwayInspector create(Pathway<?> pathway) {
        return new PathwayInspector(Objects.requireNonNull(pathway, "pathway cannot be null"));
    }

    /**
     * Gets the number of buffered messages.
     *
     * @return the current size
     */
    public int size() {
        return pathway.size();
    }

    /**
     * Gets the declared capacity; 0 for a rendezvous pathway.
     *
     * @return the capacity
     */
    public int capacity() {
        return pathway.capacity();
    }

    /**
     * Gets the current fill ratio (size/capacity). A rendezvous pathway holding a
     * pending hand-off counts as full.
     *
     * @return the fill ratio between 0.0 and 1.0
     */
    public double fillRatio() {
        int capacity = capacity();
        if (capacity == 0) {
            return size() > 0 ? 1.0 : 0.0;
        }
        return Math.min(1.0, (double) size() / capacity);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Checks if a further send would have to wait.
     *
     * @return true if the pathway is at capacity
     */
    public boolean isFull() {
        return size() >= Math.max(1, capacity());
    }

    /**
     * Checks if the fill ratio exceeds the given threshold.
     *
     * @param threshold the threshold (0.0 to 1.0)
     * @return true if fill ratio exceeds threshold
     */
    public boolean exceedsThreshold(double threshold) {
        return fillRatio() > threshold;
    }

    /**
     * Waits until the pathway is empty or timeout is reached.
     *
     * @param timeout the maximum time to wait
     * @return true if the pathway became empty, false if timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitEmpty(Duration timeout) throws InterruptedException {
        return awaitSize(0, timeout);
    }

    /**
     * Waits until exactly the given number of messages is buffered.
     *
     * @param expected the size to wait for
     * @param timeout the maximum time to wait
     * @return true if the size was reached, false if timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitSize(int expected, Duration timeout) throws InterruptedException {
        long endTime = System.currentTimeMillis() + timeout.toMillis();
        while (System.currentTimeMillis() < endTime) {
            if (size() == expected) {
                return true;
            }
            Thread.sleep(POLL_INTERVAL_MS);
        }
        return size() == expected;
    }

    /**
     * Gets a snapshot of current pathway metrics.
     *
     * @return a PathwayMetrics snapshot
     */
    public PathwayMetrics metrics() {
        return new PathwayMetrics(size(), capacity(), fillRatio(), pathway.pathwayType());
    }

    /**
     * Snapshot of pathway metrics at a point in time.
     *
     * @param size the number of buffered messages
     * @param capacity the declared capacity
     * @param fillRatio the ratio of size to capacity (0.0 to 1.0)
     * @param pathwayType the pathway implementation
     */
    public record PathwayMetrics(int size, int capacity, double fillRatio, PathwayType pathwayType) {

        @Override
        public String toString() {
            return String.format("PathwayMetrics[size=%d, capacity=%d, fillRatio=%.2f, type=%s]",
                    size, capacity, fillRatio, pathwayType);
        }
    }
}
