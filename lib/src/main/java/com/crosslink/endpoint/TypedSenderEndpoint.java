package com.crosslink.endpoint;

import com.crosslink.InternalInconsistencyException;
import com.crosslink.MessageType;
import com.crosslink.pathway.PathwaySender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link SenderEndpoint} over a {@link PathwaySender} of a known payload type.
 *
 * @param <T> The payload type
 */
public final class TypedSenderEndpoint<T> implements SenderEndpoint {

    private static final Logger logger = LoggerFactory.getLogger(TypedSenderEndpoint.class);

    private final MessageType<T> messageType;
    private final PathwaySender<T> sender;

    public TypedSenderEndpoint(MessageType<T> messageType, PathwaySender<T> sender) {
        this.messageType = Objects.requireNonNull(messageType, "messageType cannot be null");
        this.sender = Objects.requireNonNull(sender, "sender cannot be null");
    }

    @Override
    public void sendErased(Object message) throws InterruptedException {
        sender.send(downcast(message));
    }

    @Override
    public boolean sendErased(Object message, long timeout, TimeUnit unit) throws InterruptedException {
        return sender.send(downcast(message), timeout, unit);
    }

    @Override
    public boolean trySendErased(Object message) {
        return sender.trySend(downcast(message));
    }

    private T downcast(Object message) {
        if (!messageType.accepts(message)) {
            String actual = message == null ? "null" : message.getClass().getName();
            logger.error("Payload of type {} reached a sender for {} after type verification", actual, messageType);
            throw new InternalInconsistencyException(
                    "Payload of type " + actual + " cannot be sent as " + messageType, messageType.name());
        }
        return messageType.cast(message);
    }

    @Override
    public MessageType<T> messageType() {
        return messageType;
    }

    @Override
    public boolean isClosed() {
        return sender.isClosed();
    }

    @Override
    public void close() {
        sender.close();
    }

    @Override
    public String toString() {
        return "TypedSenderEndpoint{" + messageType + ", " + sender + "}";
    }
}
