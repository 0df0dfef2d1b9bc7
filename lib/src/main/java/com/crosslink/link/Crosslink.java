package com.crosslink.link;

import com.crosslink.LinkNotFoundException;
import com.crosslink.MessageType;
import com.crosslink.Router;
import com.crosslink.TypeMismatchException;
import com.crosslink.pathway.PathwayReceiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A set of declared links wired into a sealed {@link Router}.
 * <p>
 * Components obtain typed {@link EndpointHandle}s for their side of a link:
 *
 * <pre>{@code
 * Crosslink crosslink = Crosslink.builder().link(exchange).build();
 * EndpointHandle<Ping, Pong> pinger = crosslink.endpoint("Exchange", "Pinger", PING, PONG);
 * EndpointHandle<Pong, Ping> ponger = crosslink.endpoint("Exchange", "Ponger", PONG, PING);
 * }</pre>
 *
 * Each inbound receiver can be claimed by one handle only.
 */
public final class Crosslink implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Crosslink.class);

    private final Router router;
    private final Map<String, LinkSpec> links;

    Crosslink(Router router, Map<String, LinkSpec> links) {
        this.router = router;
        this.links = Map.copyOf(links);
    }

    public static CrosslinkBuilder builder() {
        return new CrosslinkBuilder();
    }

    public Router router() {
        return router;
    }

    public Set<String> linkNames() {
        return links.keySet();
    }

    /**
     * @throws LinkNotFoundException if no link with this name was declared
     */
    public LinkSpec link(String name) {
        LinkSpec spec = links.get(name);
        if (spec == null) {
            throw new LinkNotFoundException("No link named '" + name + "' was declared", name);
        }
        return spec;
    }

    /**
     * Returns the handle for one endpoint of a link, claiming its inbound receiver.
     *
     * @param link the link name
     * @param endpoint the endpoint name
     * @param sends the type this endpoint sends, or null to obtain a receive-only handle
     * @param receives the type this endpoint receives, or null to obtain a send-only handle
     * @throws LinkNotFoundException if the link was not declared
     * @throws IllegalArgumentException if the endpoint is not part of the link, or does not
     *         send or receive where a type was given
     * @throws TypeMismatchException if a type differs from the declared one
     * @throws com.crosslink.AlreadyClaimedException if the inbound receiver was already claimed
     */
    public <S, R> EndpointHandle<S, R> endpoint(String link, String endpoint,
                                                MessageType<S> sends, MessageType<R> receives) {
        LinkSpec spec = link(link);
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        if (!spec.hasEndpoint(endpoint)) {
            throw new IllegalArgumentException("Link '" + link + "' has no endpoint '" + endpoint + "'");
        }

        if (sends != null) {
            LinkSpec.Direction outbound = spec.outbound(endpoint).orElseThrow(() ->
                    new IllegalArgumentException("Endpoint '" + endpoint + "' does not send on link '" + link + "'"));
            if (!outbound.messageType().equals(sends)) {
                logger.error("Endpoint '{}' on link '{}' sends {}, not {}", endpoint, link,
                        outbound.messageType(), sends);
                throw new TypeMismatchException("Endpoint '" + endpoint + "' on link '" + link + "' sends "
                        + outbound.messageType() + ", not " + sends, spec.senderIdentity(outbound),
                        outbound.messageType().toString(), sends.toString());
            }
        }

        PathwayReceiver<R> receiver = null;
        if (receives != null) {
            LinkSpec.Direction inbound = spec.inbound(endpoint).orElseThrow(() ->
                    new IllegalArgumentException("Endpoint '" + endpoint + "' does not receive on link '" + link + "'"));
            receiver = router.takeReceiver(spec.receiverIdentity(inbound), receives);
        }
        return new EndpointHandle<>(router, spec, endpoint, sends, receiver);
    }

    /**
     * Returns a send-only handle, e.g. for the source of a unidirectional link.
     */
    public <S> EndpointHandle<S, Void> sender(String link, String endpoint, MessageType<S> sends) {
        Objects.requireNonNull(sends, "sends cannot be null");
        return endpoint(link, endpoint, sends, null);
    }

    /**
     * Returns a receive-only handle, claiming the endpoint's inbound receiver.
     */
    public <R> EndpointHandle<Void, R> receiver(String link, String endpoint, MessageType<R> receives) {
        Objects.requireNonNull(receives, "receives cannot be null");
        return endpoint(link, endpoint, null, receives);
    }

    /**
     * Closes the router: every producer end and every unclaimed receiver.
     */
    @Override
    public void close() {
        router.close();
    }
}
