package com.crosslink.pathway;

import com.crosslink.SendFailedException;
import com.crosslink.config.PathwayType;
import org.jctools.queues.MpscArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * High-throughput pathway using a JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free enqueue from any number of sending threads
 * - An exact capacity bound, independent of the power-of-two queue size
 * - Blocking sends via spin-wait with adaptive sleep
 *
 * Trade-offs:
 * - Capacity must be at least 1 (no rendezvous)
 * - Blocked senders spin instead of parking on a condition
 * - Every dequeue takes the consumer lock, which is uncontended while one thread drains
 *
 * The queue is only ever polled while holding the consumer lock, so closing the receiver
 * from another thread, or a sender discarding after a concurrent close, never acts as a
 * second consumer.
 *
 * @param <T> The type of messages
 */
public class MpscPathway<T> implements Pathway<T> {

    private static final Logger logger = LoggerFactory.getLogger(MpscPathway.class);

    private static final int SPINS_BEFORE_SLEEP = 128;
    private static final int SPINS_BEFORE_YIELD = 1000;
    private static final long CONSUMER_RECHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final MpscArrayQueue<T> queue;
    private final AtomicInteger reserved = new AtomicInteger();
    // Sends that passed the open check and have not yet finished enqueueing
    private final AtomicInteger inFlight = new AtomicInteger();
    private final int capacity;
    private final String name;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean hasWaitingConsumer = false;

    private volatile boolean producerClosed = false;
    private volatile boolean consumerClosed = false;

    private final Sender sender = new Sender();
    private final Receiver receiver = new Receiver();

    /**
     * Creates an MPSC pathway with the specified capacity.
     *
     * @param capacity the maximum number of buffered messages (must be >= 1)
     */
    public MpscPathway(int capacity) {
        this(capacity, "pathway");
    }

    /**
     * Creates an MPSC pathway with the specified capacity and a name used in error messages.
     *
     * @param capacity the maximum number of buffered messages (must be >= 1)
     * @param name the pathway name
     */
    public MpscPathway(int capacity, String name) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be >= 1 for an MPSC pathway, got: " + capacity);
        }
        this.capacity = capacity;
        // JCTools requires at least 2 and rounds up to a power of 2
        this.queue = new MpscArrayQueue<>(Math.max(2, capacity));
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public PathwaySender<T> sender() {
        return sender;
    }

    @Override
    public PathwayReceiver<T> receiver() {
        return receiver;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int size() {
        return reserved.get();
    }

    @Override
    public PathwayType pathwayType() {
        return PathwayType.MPSC;
    }

    @Override
    public String toString() {
        return "MpscPathway{" + name + ", capacity=" + capacity + "}";
    }

    private void checkOpen() {
        if (consumerClosed) {
            throw new SendFailedException("Receiver of " + name + " has been closed", name);
        }
        if (producerClosed) {
            throw new SendFailedException("Sender of " + name + " has been closed", name);
        }
    }

    /**
     * Reserves a slot and enqueues. Returns false if the pathway is full.
     * <p>
     * The send counts as in flight from before the open check until the message is in the
     * queue, so a receiver that sees the producer end closed waits for it before reporting
     * end-of-stream.
     */
    private boolean offer(T message) {
        inFlight.incrementAndGet();
        try {
            checkOpen();
            if (!reserve()) {
                return false;
            }
            if (!queue.offer(message)) {
                // The reservation bounds occupancy below the queue size, so this cannot happen
                reserved.decrementAndGet();
                throw new IllegalStateException("MPSC queue of " + name + " rejected a reserved message");
            }
            if (consumerClosed) {
                // The receiver closed while this message was being enqueued; nobody will take it
                discardBuffered();
                throw new SendFailedException("Receiver of " + name + " closed during send", name);
            }
        } finally {
            inFlight.decrementAndGet();
        }
        signalNotEmpty();
        return true;
    }

    private boolean reserve() {
        while (true) {
            int current = reserved.get();
            if (current >= capacity) {
                return false;
            }
            if (reserved.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Empties the queue once the consumer end is closed.
     */
    private int discardBuffered() {
        lock.lock();
        try {
            int discarded = 0;
            while (dequeueLocked() != null) {
                discarded++;
            }
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Polls the queue. Callers hold the lock, which makes them the single consumer.
     */
    private T dequeueLocked() {
        T message = queue.poll();
        if (message != null) {
            reserved.decrementAndGet();
        }
        return message;
    }

    /**
     * True once the producer end is closed and no send can still land in the queue.
     * Read before the final poll that decides end-of-stream.
     */
    private boolean producerDone() {
        return producerClosed && inFlight.get() == 0;
    }

    /**
     * Signals the waiting consumer that a message is available.
     * Only acquires the lock if the consumer is actually waiting.
     */
    private void signalNotEmpty() {
        if (hasWaitingConsumer) {
            signalAllLocked();
        }
    }

    private void signalAllLocked() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private final class Sender implements PathwaySender<T> {

        @Override
        public void send(T message) throws InterruptedException {
            Objects.requireNonNull(message, "Message cannot be null");
            blockingOffer(message, Long.MAX_VALUE);
        }

        @Override
        public boolean send(T message, long timeout, TimeUnit unit) throws InterruptedException {
            Objects.requireNonNull(message, "Message cannot be null");
            long deadline = System.nanoTime() + unit.toNanos(timeout);
            return blockingOffer(message, deadline);
        }

        /**
         * Blocking offer with spin-wait and adaptive sleep.
         */
        private boolean blockingOffer(T message, long deadlineNanos) throws InterruptedException {
            int spins = 0;
            while (true) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted while sending on " + name);
                }
                if (offer(message)) {
                    return true;
                }
                if (deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0) {
                    return false;
                }

                Thread.onSpinWait();
                spins++;

                if (spins > SPINS_BEFORE_SLEEP) {
                    // After many spins, use a tiny sleep to avoid busy-waiting
                    Thread.sleep(0, 200);
                }

                if (spins > SPINS_BEFORE_YIELD) {
                    Thread.yield();
                    spins = 0;
                }
            }
        }

        @Override
        public boolean trySend(T message) {
            Objects.requireNonNull(message, "Message cannot be null");
            return offer(message);
        }

        @Override
        public boolean isClosed() {
            return consumerClosed;
        }

        @Override
        public void close() {
            if (producerClosed) {
                return;
            }
            producerClosed = true;
            signalAllLocked();
        }

        @Override
        public int capacity() {
            return capacity;
        }

        @Override
        public String toString() {
            return "Sender{" + name + "}";
        }
    }

    private final class Receiver implements PathwayReceiver<T> {

        @Override
        public Optional<T> receive() throws InterruptedException {
            lock.lockInterruptibly();
            try {
                hasWaitingConsumer = true;
                while (true) {
                    if (consumerClosed) {
                        return Optional.empty();
                    }
                    T message = dequeueLocked();
                    if (message != null) {
                        return Optional.of(message);
                    }
                    if (producerDone()) {
                        // A send may have completed between the poll above and the check
                        return Optional.ofNullable(dequeueLocked());
                    }
                    notEmpty.awaitNanos(CONSUMER_RECHECK_NANOS);
                }
            } finally {
                hasWaitingConsumer = false;
                lock.unlock();
            }
        }

        @Override
        public T poll() {
            lock.lock();
            try {
                return consumerClosed ? null : dequeueLocked();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public T poll(long timeout, TimeUnit unit) throws InterruptedException {
            long deadline = System.nanoTime() + unit.toNanos(timeout);
            lock.lockInterruptibly();
            try {
                hasWaitingConsumer = true;
                while (true) {
                    if (consumerClosed) {
                        return null;
                    }
                    T message = dequeueLocked();
                    if (message != null) {
                        return message;
                    }
                    if (producerDone()) {
                        return dequeueLocked();
                    }
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return null;
                    }
                    notEmpty.awaitNanos(Math.min(remaining, CONSUMER_RECHECK_NANOS));
                }
            } finally {
                hasWaitingConsumer = false;
                lock.unlock();
            }
        }

        @Override
        public int drainTo(Collection<? super T> collection, int maxElements) {
            Objects.requireNonNull(collection, "Collection cannot be null");
            lock.lock();
            try {
                if (consumerClosed) {
                    return 0;
                }
                int count = 0;
                while (count < maxElements) {
                    T message = dequeueLocked();
                    if (message == null) {
                        break;
                    }
                    collection.add(message);
                    count++;
                }
                return count;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public int size() {
            return reserved.get();
        }

        @Override
        public boolean isTerminated() {
            return consumerClosed || (producerDone() && queue.isEmpty());
        }

        @Override
        public void close() {
            if (consumerClosed) {
                return;
            }
            consumerClosed = true;
            int discarded = discardBuffered();
            if (discarded > 0) {
                logger.debug("Discarded {} undelivered message(s) on closing {}", discarded, name);
            }
            signalAllLocked();
        }

        @Override
        public String toString() {
            return "Receiver{" + name + "}";
        }
    }
}
