package com.crosslink.pathway;

import com.crosslink.SendFailedException;
import com.crosslink.config.PathwayType;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default pathway implementation: a bounded buffer guarded by one lock.
 *
 * Recommended for:
 * - General-purpose links between components
 * - Rendezvous hand-off (capacity 0)
 * - When exact, lock-based back-pressure is preferred over spinning
 *
 * With capacity 0 a send returns only after the consumer has taken the value. If the
 * sender is interrupted or times out before that, the value is withdrawn again, so a
 * cancelled send is never also a delivered one.
 *
 * @param <T> The type of messages
 */
public class LinkedPathway<T> implements Pathway<T> {

    private static final int INITIAL_BUFFER_SIZE = 16;

    private final ArrayDeque<T> buffer;
    private final int capacity;
    private final int slots;
    private final String name;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();
    private final Condition handedOff = lock.newCondition();

    // Guarded by lock
    private boolean producerClosed;
    private boolean consumerClosed;
    private long enqueued;
    private long dequeued;

    private final Sender sender = new Sender();
    private final Receiver receiver = new Receiver();

    /**
     * Creates a bounded pathway with the specified capacity.
     *
     * @param capacity the maximum number of buffered messages, 0 for rendezvous
     */
    public LinkedPathway(int capacity) {
        this(capacity, "pathway");
    }

    /**
     * Creates a bounded pathway with the specified capacity and a name used in error messages.
     *
     * @param capacity the maximum number of buffered messages, 0 for rendezvous
     * @param name the pathway name
     */
    public LinkedPathway(int capacity, String name) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must be >= 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.slots = Math.max(1, capacity);
        // Grows on demand; capacity is only the bound
        this.buffer = new ArrayDeque<>(Math.min(slots, INITIAL_BUFFER_SIZE));
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
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PathwayType pathwayType() {
        return PathwayType.LINKED;
    }

    @Override
    public String toString() {
        return "LinkedPathway{" + name + ", capacity=" + capacity + "}";
    }

    private boolean isRendezvous() {
        return capacity == 0;
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
     * Appends under the lock; caller has verified there is a free slot.
     * Returns the ticket of the enqueued message.
     */
    private long enqueueLocked(T message) {
        buffer.addLast(message);
        enqueued++;
        notEmpty.signal();
        return enqueued;
    }

    private T dequeueLocked() {
        T message = buffer.pollFirst();
        if (message != null) {
            dequeued++;
            notFull.signal();
            if (isRendezvous()) {
                handedOff.signalAll();
            }
        }
        return message;
    }

    /**
     * Waits for the consumer to take the message holding the given ticket.
     * Withdraws it if the wait ends first (interrupt or deadline).
     *
     * @return true if handed off, false if the deadline passed and the message was withdrawn
     */
    private boolean awaitHandOffLocked(long ticket, T message, long deadlineNanos) throws InterruptedException {
        try {
            while (dequeued < ticket) {
                if (consumerClosed) {
                    throw new SendFailedException("Receiver of " + name + " closed before hand-off", name);
                }
                if (deadlineNanos == Long.MAX_VALUE) {
                    handedOff.await();
                } else {
                    long remaining = deadlineNanos - System.nanoTime();
                    if (remaining <= 0) {
                        withdrawLocked(message);
                        return false;
                    }
                    handedOff.awaitNanos(remaining);
                }
            }
            return true;
        } catch (InterruptedException e) {
            if (dequeued >= ticket) {
                // Already taken: the send completed, keep the interrupt for the caller
                Thread.currentThread().interrupt();
                return true;
            }
            withdrawLocked(message);
            throw e;
        }
    }

    private void withdrawLocked(T message) {
        if (buffer.removeLastOccurrence(message)) {
            enqueued--;
            notFull.signal();
        }
    }

    private final class Sender implements PathwaySender<T> {

        @Override
        public void send(T message) throws InterruptedException {
            Objects.requireNonNull(message, "Message cannot be null");
            lock.lockInterruptibly();
            try {
                checkOpen();
                while (buffer.size() >= slots) {
                    notFull.await();
                    checkOpen();
                }
                long ticket = enqueueLocked(message);
                if (isRendezvous()) {
                    awaitHandOffLocked(ticket, message, Long.MAX_VALUE);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean send(T message, long timeout, TimeUnit unit) throws InterruptedException {
            Objects.requireNonNull(message, "Message cannot be null");
            long deadline = System.nanoTime() + unit.toNanos(timeout);
            lock.lockInterruptibly();
            try {
                checkOpen();
                while (buffer.size() >= slots) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    notFull.awaitNanos(remaining);
                    checkOpen();
                }
                long ticket = enqueueLocked(message);
                if (isRendezvous()) {
                    return awaitHandOffLocked(ticket, message, deadline);
                }
                return true;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean trySend(T message) {
            Objects.requireNonNull(message, "Message cannot be null");
            lock.lock();
            try {
                checkOpen();
                // A rendezvous pathway only accepts immediately if it never has to wait
                if (isRendezvous() || buffer.size() >= slots) {
                    return false;
                }
                enqueueLocked(message);
                return true;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean isClosed() {
            lock.lock();
            try {
                return consumerClosed;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                if (producerClosed) {
                    return;
                }
                producerClosed = true;
                notEmpty.signalAll();
                notFull.signalAll();
            } finally {
                lock.unlock();
            }
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
                while (buffer.isEmpty()) {
                    if (producerClosed || consumerClosed) {
                        return Optional.empty();
                    }
                    notEmpty.await();
                }
                return Optional.of(dequeueLocked());
            } finally {
                lock.unlock();
            }
        }

        @Override
        public T poll() {
            lock.lock();
            try {
                return dequeueLocked();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public T poll(long timeout, TimeUnit unit) throws InterruptedException {
            long nanos = unit.toNanos(timeout);
            lock.lockInterruptibly();
            try {
                while (buffer.isEmpty()) {
                    if (producerClosed || consumerClosed || nanos <= 0) {
                        return null;
                    }
                    nanos = notEmpty.awaitNanos(nanos);
                }
                return dequeueLocked();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public int drainTo(Collection<? super T> collection, int maxElements) {
            Objects.requireNonNull(collection, "Collection cannot be null");
            lock.lock();
            try {
                int count = 0;
                while (count < maxElements && !buffer.isEmpty()) {
                    collection.add(dequeueLocked());
                    count++;
                }
                if (count > 0) {
                    notFull.signalAll();
                }
                return count;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public int size() {
            return LinkedPathway.this.size();
        }

        @Override
        public boolean isTerminated() {
            lock.lock();
            try {
                return (producerClosed || consumerClosed) && buffer.isEmpty();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                if (consumerClosed) {
                    return;
                }
                consumerClosed = true;
                buffer.clear();
                notFull.signalAll();
                notEmpty.signalAll();
                handedOff.signalAll();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public String toString() {
            return "Receiver{" + name + "}";
        }
    }
}
