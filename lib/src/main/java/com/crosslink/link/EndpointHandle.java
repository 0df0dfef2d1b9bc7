package com.crosslink.link;

import com.crosslink.EndpointId;
import com.crosslink.MessageType;
import com.crosslink.Router;
import com.crosslink.pathway.PathwayReceiver;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * One endpoint's typed view of a link: sends go out through the router, receives come
 * from the inbound receiver this handle has claimed.
 *
 * @param <S> The type this endpoint sends
 * @param <R> The type this endpoint receives
 */
public final class EndpointHandle<S, R> implements AutoCloseable {

    private final Router router;
    private final String link;
    private final String endpoint;
    private final LinkSpec.Addressing addressing;
    private final EndpointId<S> outboundId;
    private final PathwayReceiver<R> receiver;

    EndpointHandle(Router router, LinkSpec spec, String endpoint, MessageType<S> sends, PathwayReceiver<R> receiver) {
        this.router = router;
        this.link = spec.name();
        this.endpoint = endpoint;
        this.addressing = spec.addressing();
        this.outboundId = sends == null ? null : EndpointId.of(endpoint, sends);
        this.receiver = receiver;
    }

    public String link() {
        return link;
    }

    public String endpoint() {
        return endpoint;
    }

    public boolean canSend() {
        return outboundId != null;
    }

    public boolean canReceive() {
        return receiver != null;
    }

    /**
     * Sends to the peer, waiting for buffer space.
     *
     * @throws com.crosslink.SendFailedException if the peer has closed its receiver
     * @throws InterruptedException if interrupted while waiting
     */
    public void send(S message) throws InterruptedException {
        requireSending();
        if (addressing == LinkSpec.Addressing.ENDPOINT) {
            router.send(outboundId, message);
        } else {
            router.sendOnLink(link, endpoint, message);
        }
    }

    /**
     * Sends to the peer, waiting at most the given time for buffer space.
     *
     * @return true if enqueued, false on timeout
     */
    public boolean send(S message, long timeout, TimeUnit unit) throws InterruptedException {
        requireSending();
        if (addressing == LinkSpec.Addressing.ENDPOINT) {
            return router.send(outboundId, message, timeout, unit);
        }
        return router.sendOnLink(link, endpoint, message, timeout, unit);
    }

    /**
     * Sends to the peer only if buffer space is available now.
     *
     * @return true if enqueued
     */
    public boolean trySend(S message) {
        requireSending();
        if (addressing == LinkSpec.Addressing.ENDPOINT) {
            return router.trySend(outboundId, message);
        }
        return router.trySendOnLink(link, endpoint, message);
    }

    /**
     * Waits for the next message from the peer.
     *
     * @return the message, or empty once the peer's side is closed and drained
     */
    public Optional<R> receive() throws InterruptedException {
        return requireReceiving().receive();
    }

    /**
     * @return the next message, or null if none arrives in time
     */
    public R poll(long timeout, TimeUnit unit) throws InterruptedException {
        return requireReceiving().poll(timeout, unit);
    }

    public PathwayReceiver<R> receiver() {
        return requireReceiving();
    }

    /**
     * Closes the inbound receiver. Further sends from the peer fail.
     */
    @Override
    public void close() {
        if (receiver != null) {
            receiver.close();
        }
    }

    private void requireSending() {
        if (outboundId == null) {
            throw new IllegalStateException("Endpoint '" + endpoint + "' on link '" + link + "' is receive-only");
        }
    }

    private PathwayReceiver<R> requireReceiving() {
        if (receiver == null) {
            throw new IllegalStateException("Endpoint '" + endpoint + "' on link '" + link + "' is send-only");
        }
        return receiver;
    }

    @Override
    public String toString() {
        return "EndpointHandle{" + link + "/" + endpoint + "}";
    }
}
