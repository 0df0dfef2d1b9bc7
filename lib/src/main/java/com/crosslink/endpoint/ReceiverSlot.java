package com.crosslink.endpoint;

import com.crosslink.InternalInconsistencyException;
import com.crosslink.MessageType;
import com.crosslink.pathway.PathwayReceiver;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds a registered consumer end until exactly one caller claims it.
 * <p>
 * The claim is a single atomic swap, so concurrent claimers race safely: one gets the
 * receiver, the others see an empty slot.
 *
 * @param <T> The payload type
 */
public final class ReceiverSlot<T> {

    private final MessageType<T> messageType;
    private final AtomicReference<PathwayReceiver<T>> slot;

    public ReceiverSlot(MessageType<T> messageType, PathwayReceiver<T> receiver) {
        this.messageType = Objects.requireNonNull(messageType, "messageType cannot be null");
        this.slot = new AtomicReference<>(Objects.requireNonNull(receiver, "receiver cannot be null"));
    }

    public MessageType<T> messageType() {
        return messageType;
    }

    /**
     * Claims the receiver.
     *
     * @return the receiver, or empty if it was already claimed
     */
    public Optional<PathwayReceiver<T>> take() {
        return Optional.ofNullable(slot.getAndSet(null));
    }

    public boolean isClaimed() {
        return slot.get() == null;
    }

    /**
     * Closes the receiver if nobody has claimed it, so its senders fail instead of
     * filling a buffer that will never be drained.
     *
     * @return true if an unclaimed receiver was closed
     */
    public boolean discard() {
        PathwayReceiver<T> receiver = slot.getAndSet(null);
        if (receiver == null) {
            return false;
        }
        receiver.close();
        return true;
    }

    /**
     * Views this slot under a tag whose class has already been verified equal.
     */
    @SuppressWarnings("unchecked")
    public <U> ReceiverSlot<U> narrow(MessageType<U> expected) {
        if (!messageType.javaType().equals(expected.javaType())) {
            throw new InternalInconsistencyException(
                    "Receiver slot for " + messageType + " cannot be viewed as " + expected, messageType.name());
        }
        return (ReceiverSlot<U>) (ReceiverSlot<?>) this;
    }

    @Override
    public String toString() {
        return "ReceiverSlot{" + messageType + (isClaimed() ? ", claimed" : ", available") + "}";
    }
}
