package com.crosslink;

import com.crosslink.config.RouterConfig;
import com.crosslink.endpoint.ReceiverSlot;
import com.crosslink.endpoint.SenderEndpoint;
import com.crosslink.pathway.PathwayReceiver;
import com.crosslink.pathway.PathwaySender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Central registry and dispatcher for typed pathways.
 * <p>
 * The router has two phases. During setup, a single thread registers producer ends
 * ({@link #registerSender}), consumer ends ({@link #registerReceiver}) and link pathways
 * ({@link #registerPathway}). {@link #seal()} then freezes the registries, after which the
 * router is shared freely between threads: sends and claims never take a router-level
 * lock, and each pathway provides its own synchronisation.
 * <p>
 * Messages are addressed in one of two ways:
 * <ul>
 *   <li>By identity: {@link #send(EndpointId, Object)} delivers to the sender registered
 *       under the identity's name. The payload must match the registered type.</li>
 *   <li>By link: {@link #sendOnLink(String, Object)} selects the pathway on the link that is
 *       mapped to the payload's runtime type.</li>
 * </ul>
 * Consumer ends are claimed once with {@link #takeReceiver(EndpointId)}; ownership then
 * passes to the caller.
 */
public class Router implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    private final RouterConfig config;
    private final String name;

    // Mutable during setup, replaced by immutable copies on seal
    private volatile Map<String, SenderEndpoint> senders = new LinkedHashMap<>();
    private volatile Map<String, ReceiverSlot<?>> receivers = new LinkedHashMap<>();
    private volatile Map<DispatchKey, SenderEndpoint> pathways = new LinkedHashMap<>();
    private volatile Map<String, LinkRoutes> links = new LinkedHashMap<>();

    private volatile boolean sealed = false;
    private volatile boolean closed = false;

    /**
     * Creates a router with default configuration.
     */
    public Router() {
        this(new RouterConfig());
    }

    /**
     * Creates a router with the given configuration.
     *
     * @param config the router configuration
     */
    public Router(RouterConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.name = config.getName();
    }

    public RouterConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------------------

    /**
     * Registers the producer end for an identity.
     *
     * @throws DuplicateRegistrationException if a sender is already registered under the name
     * @throws IllegalStateException if the router is sealed
     */
    public <T> void registerSender(EndpointId<T> id, PathwaySender<T> sender) {
        Objects.requireNonNull(id, "id cannot be null");
        registerSender(id.name(), SenderEndpoint.of(id.messageType(), sender));
    }

    /**
     * Registers a type-erased producer end under an identity.
     *
     * @throws DuplicateRegistrationException if a sender is already registered under the identity
     * @throws IllegalStateException if the router is sealed
     */
    public void registerSender(String identity, SenderEndpoint endpoint) {
        requireIdentity(identity);
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        checkSetupPhase();
        if (senders.containsKey(identity)) {
            throw new DuplicateRegistrationException("Sender already registered for identity '" + identity + "'",
                    identity);
        }
        senders.put(identity, endpoint);
        logger.debug("Router '{}' registered sender '{}' for {}", name, identity, endpoint.messageType());
    }

    /**
     * Registers the consumer end for an identity, available to be claimed once.
     *
     * @throws DuplicateRegistrationException if a receiver is already registered under the name
     * @throws IllegalStateException if the router is sealed
     */
    public <T> void registerReceiver(EndpointId<T> id, PathwayReceiver<T> receiver) {
        Objects.requireNonNull(id, "id cannot be null");
        registerReceiver(id.name(), new ReceiverSlot<>(id.messageType(), receiver));
    }

    /**
     * Registers a claimable consumer end under an identity.
     *
     * @throws DuplicateRegistrationException if a receiver is already registered under the identity
     * @throws IllegalStateException if the router is sealed
     */
    public void registerReceiver(String identity, ReceiverSlot<?> slot) {
        requireIdentity(identity);
        Objects.requireNonNull(slot, "slot cannot be null");
        checkSetupPhase();
        if (receivers.containsKey(identity)) {
            throw new DuplicateRegistrationException("Receiver already registered for identity '" + identity + "'",
                    identity);
        }
        receivers.put(identity, slot);
        logger.debug("Router '{}' registered receiver '{}' for {}", name, identity, slot.messageType());
    }

    /**
     * Registers the producer end of the pathway from {@code source} to {@code target} on a
     * link and maps the message type to it, so that link-addressed sends of that type are
     * routed here. Nothing is recorded if the registration fails.
     *
     * @return the dispatch key of the registered pathway
     * @throws IllegalArgumentException if a name is malformed
     * @throws DuplicateRegistrationException if the dispatch key is already registered
     * @throws AmbiguousDispatchException if the type is already mapped on the link
     * @throws IllegalStateException if the router is sealed
     */
    public <T> DispatchKey registerPathway(String link, String source, String target,
                                           MessageType<T> messageType, PathwaySender<T> sender) {
        DispatchKey key = new DispatchKey(link, source, target);
        Objects.requireNonNull(messageType, "messageType cannot be null");
        Objects.requireNonNull(sender, "sender cannot be null");
        checkSetupPhase();

        if (pathways.containsKey(key)) {
            throw new DuplicateRegistrationException("Pathway already registered for " + key, key.asString());
        }
        LinkRoutes routes = links.get(link);
        boolean newLink = routes == null;
        if (newLink) {
            routes = new LinkRoutes(link);
        }
        routes.add(messageType, key, config.isDirectionQualifiedDispatch());
        if (newLink) {
            links.put(link, routes);
        }
        pathways.put(key, SenderEndpoint.of(messageType, sender));
        logger.debug("Router '{}' registered pathway {} for {}", name, key, messageType);
        return key;
    }

    /**
     * Ends the setup phase. Registries become immutable and later registration fails.
     * Calling seal more than once has no further effect.
     */
    public synchronized void seal() {
        if (sealed) {
            return;
        }
        Map<String, LinkRoutes> frozenLinks = new LinkedHashMap<>();
        links.forEach((link, routes) -> frozenLinks.put(link, routes.freeze()));

        senders = Collections.unmodifiableMap(new LinkedHashMap<>(senders));
        receivers = Collections.unmodifiableMap(new LinkedHashMap<>(receivers));
        pathways = Collections.unmodifiableMap(new LinkedHashMap<>(pathways));
        links = Collections.unmodifiableMap(frozenLinks);
        sealed = true;

        logger.info("Router '{}' sealed with {} sender(s), {} receiver(s), {} pathway(s) on {} link(s)",
                name, senders.size(), receivers.size(), pathways.size(), links.size());
    }

    public boolean isSealed() {
        return sealed;
    }

    // ---------------------------------------------------------------------------------
    // Identity-addressed sends
    // ---------------------------------------------------------------------------------

    /**
     * Sends to the pathway registered under the identity, waiting for buffer space.
     *
     * @throws PathwayNotFoundException if no sender is registered under the identity
     * @throws TypeMismatchException if the identity was registered with another type
     * @throws SendFailedException if the consumer end is closed
     * @throws InterruptedException if interrupted while waiting
     */
    public <T> void send(EndpointId<T> id, T message) throws InterruptedException {
        deliver(id.name(), resolveIdentity(id.name(), id.messageType(), message), message);
    }

    /**
     * Untyped form of {@link #send(EndpointId, Object)}; the payload's runtime type is
     * checked against the registered type before the pathway is touched.
     */
    public void send(String identity, Object message) throws InterruptedException {
        deliver(identity, resolveIdentity(identity, null, message), message);
    }

    /**
     * Sends to the identity, waiting at most the given time for buffer space.
     *
     * @return true if enqueued, false on timeout
     */
    public <T> boolean send(EndpointId<T> id, T message, long timeout, TimeUnit unit) throws InterruptedException {
        return deliver(id.name(), resolveIdentity(id.name(), id.messageType(), message), message, timeout, unit);
    }

    /**
     * Sends to the identity only if buffer space is available now.
     *
     * @return true if enqueued
     */
    public <T> boolean trySend(EndpointId<T> id, T message) {
        return tryDeliver(id.name(), resolveIdentity(id.name(), id.messageType(), message), message);
    }

    public boolean trySend(String identity, Object message) {
        return tryDeliver(identity, resolveIdentity(identity, null, message), message);
    }

    private SenderEndpoint resolveIdentity(String identity, MessageType<?> expected, Object message) {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
        SenderEndpoint endpoint = senders.get(identity);
        if (endpoint == null) {
            throw new PathwayNotFoundException("No sender registered for identity '" + identity + "'", identity);
        }
        MessageType<?> registered = endpoint.messageType();
        if (expected != null && !registered.equals(expected)) {
            throw typeMismatch(identity, registered, expected.toString());
        }
        if (!registered.accepts(message)) {
            throw typeMismatch(identity, registered, MessageType.describe(message));
        }
        return endpoint;
    }

    // ---------------------------------------------------------------------------------
    // Link-addressed sends
    // ---------------------------------------------------------------------------------

    /**
     * Sends on a link, selecting the pathway mapped to the payload's runtime type and
     * waiting for buffer space.
     *
     * @throws LinkNotFoundException if nothing is registered for the link
     * @throws MessageTypeNotMappedException if the link carries no pathway for the type
     * @throws AmbiguousDispatchException if the type travels both directions of the link
     * @throws SendFailedException if the consumer end is closed
     * @throws InterruptedException if interrupted while waiting
     */
    public void sendOnLink(String link, Object message) throws InterruptedException {
        DispatchKey key = resolveLink(link, null, message);
        deliver(key.asString(), pathways.get(key), message);
    }

    /**
     * Sends on a link from the named endpoint. Required when the payload type travels in
     * both directions (see {@link RouterConfig#setDirectionQualifiedDispatch(boolean)}).
     */
    public void sendOnLink(String link, String source, Object message) throws InterruptedException {
        Objects.requireNonNull(source, "source cannot be null");
        DispatchKey key = resolveLink(link, source, message);
        deliver(key.asString(), pathways.get(key), message);
    }

    /**
     * Sends on a link, waiting at most the given time for buffer space.
     *
     * @return true if enqueued, false on timeout
     */
    public boolean sendOnLink(String link, Object message, long timeout, TimeUnit unit) throws InterruptedException {
        DispatchKey key = resolveLink(link, null, message);
        return deliver(key.asString(), pathways.get(key), message, timeout, unit);
    }

    public boolean sendOnLink(String link, String source, Object message, long timeout, TimeUnit unit)
            throws InterruptedException {
        Objects.requireNonNull(source, "source cannot be null");
        DispatchKey key = resolveLink(link, source, message);
        return deliver(key.asString(), pathways.get(key), message, timeout, unit);
    }

    /**
     * Sends on a link only if buffer space is available now.
     *
     * @return true if enqueued
     */
    public boolean trySendOnLink(String link, Object message) {
        DispatchKey key = resolveLink(link, null, message);
        return tryDeliver(key.asString(), pathways.get(key), message);
    }

    public boolean trySendOnLink(String link, String source, Object message) {
        Objects.requireNonNull(source, "source cannot be null");
        DispatchKey key = resolveLink(link, source, message);
        return tryDeliver(key.asString(), pathways.get(key), message);
    }

    /**
     * Sends directly to the pathway with the given dispatch key.
     *
     * @throws PathwayNotFoundException if no pathway is registered for the key
     * @throws TypeMismatchException if the pathway carries another type
     */
    public void sendToPathway(DispatchKey key, Object message) throws InterruptedException {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
        SenderEndpoint endpoint = pathways.get(key);
        if (endpoint == null) {
            throw new PathwayNotFoundException("No pathway registered for " + key, key.asString());
        }
        if (!endpoint.messageType().accepts(message)) {
            throw typeMismatch(key.asString(), endpoint.messageType(), MessageType.describe(message));
        }
        deliver(key.asString(), endpoint, message);
    }

    private DispatchKey resolveLink(String link, String source, Object message) {
        Objects.requireNonNull(link, "link cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
        LinkRoutes routes = links.get(link);
        if (routes == null) {
            throw new LinkNotFoundException("No pathways registered for link '" + link + "'", link);
        }
        LinkRoutes.Route route = routes.resolve(message, source);
        SenderEndpoint endpoint = pathways.get(route.key());
        if (endpoint == null) {
            logger.error("Router '{}' maps {} on link '{}' to {} but holds no sender for it",
                    name, route.messageType(), link, route.key());
            throw new InternalInconsistencyException("Mapped pathway " + route.key() + " has no sender",
                    route.key().asString());
        }
        return route.key();
    }

    // ---------------------------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------------------------

    private void deliver(String subject, SenderEndpoint endpoint, Object message) throws InterruptedException {
        try {
            endpoint.sendErased(message);
        } catch (SendFailedException e) {
            throw sendFailed(subject, e);
        }
    }

    private boolean deliver(String subject, SenderEndpoint endpoint, Object message, long timeout, TimeUnit unit)
            throws InterruptedException {
        try {
            return endpoint.sendErased(message, timeout, unit);
        } catch (SendFailedException e) {
            throw sendFailed(subject, e);
        }
    }

    private boolean tryDeliver(String subject, SenderEndpoint endpoint, Object message) {
        try {
            return endpoint.trySendErased(message);
        } catch (SendFailedException e) {
            throw sendFailed(subject, e);
        }
    }

    private SendFailedException sendFailed(String subject, SendFailedException cause) {
        logger.debug("Router '{}' could not deliver to '{}': {}", name, subject, cause.getMessage());
        return new SendFailedException("Send to '" + subject + "' failed: " + cause.getMessage(), subject, cause);
    }

    private TypeMismatchException typeMismatch(String subject, MessageType<?> registered, String requested) {
        logger.error("Router '{}' type mismatch on '{}': registered {}, got {}", name, subject, registered, requested);
        return new TypeMismatchException("Identity '" + subject + "' carries " + registered + ", not " + requested,
                subject, registered.toString(), requested);
    }

    // ---------------------------------------------------------------------------------
    // Claiming receivers
    // ---------------------------------------------------------------------------------

    /**
     * Claims the consumer end registered under the identity. Succeeds at most once per
     * identity; ownership of the receiver passes to the caller.
     *
     * @throws PathwayNotFoundException if no receiver is registered under the identity
     * @throws TypeMismatchException if the receiver was registered with another type
     * @throws AlreadyClaimedException if the receiver was already claimed
     */
    public <T> PathwayReceiver<T> takeReceiver(EndpointId<T> id) {
        Objects.requireNonNull(id, "id cannot be null");
        return takeReceiver(id.name(), id.messageType());
    }

    public <T> PathwayReceiver<T> takeReceiver(String identity, MessageType<T> expected) {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(expected, "expected cannot be null");
        ReceiverSlot<?> slot = receivers.get(identity);
        if (slot == null) {
            throw new PathwayNotFoundException("No receiver registered for identity '" + identity + "'", identity);
        }
        if (!slot.messageType().equals(expected)) {
            throw typeMismatch(identity, slot.messageType(), expected.toString());
        }
        ReceiverSlot<T> typed = slot.narrow(expected);
        return typed.take().orElseThrow(() -> {
            logger.warn("Router '{}' receiver '{}' was already claimed", name, identity);
            return new AlreadyClaimedException("Receiver for identity '" + identity + "' was already claimed",
                    identity);
        });
    }

    /**
     * Non-throwing form of {@link #takeReceiver(EndpointId)}.
     *
     * @return the receiver, or a failure holding the exception takeReceiver would throw
     */
    public <T> Result<PathwayReceiver<T>> claim(EndpointId<T> id) {
        return Result.attempt(() -> takeReceiver(id));
    }

    public <T> Result<PathwayReceiver<T>> claim(String identity, MessageType<T> expected) {
        return Result.attempt(() -> takeReceiver(identity, expected));
    }

    // ---------------------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------------------

    public Set<String> senderIdentities() {
        return Set.copyOf(senders.keySet());
    }

    public Set<String> receiverIdentities() {
        return Set.copyOf(receivers.keySet());
    }

    /**
     * @throws PathwayNotFoundException if no receiver is registered under the identity
     */
    public boolean isClaimed(String identity) {
        ReceiverSlot<?> slot = receivers.get(identity);
        if (slot == null) {
            throw new PathwayNotFoundException("No receiver registered for identity '" + identity + "'", identity);
        }
        return slot.isClaimed();
    }

    public Set<String> links() {
        return Set.copyOf(links.keySet());
    }

    public Set<DispatchKey> dispatchKeys() {
        return Set.copyOf(pathways.keySet());
    }

    /**
     * Returns the message type carried by each pathway of a link.
     *
     * @throws LinkNotFoundException if nothing is registered for the link
     */
    public Map<DispatchKey, MessageType<?>> pathwaysOf(String link) {
        if (!links.containsKey(link)) {
            throw new LinkNotFoundException("No pathways registered for link '" + link + "'", link);
        }
        Map<DispatchKey, MessageType<?>> result = new HashMap<>();
        pathways.forEach((key, endpoint) -> {
            if (key.link().equals(link)) {
                result.put(key, endpoint.messageType());
            }
        });
        return Map.copyOf(result);
    }

    // ---------------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------------

    /**
     * Closes every registered producer end and every unclaimed consumer end. Receivers
     * already claimed drain what is buffered and then see end-of-stream.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        senders.values().forEach(SenderEndpoint::close);
        pathways.values().forEach(SenderEndpoint::close);
        int discarded = 0;
        for (ReceiverSlot<?> slot : receivers.values()) {
            if (slot.discard()) {
                discarded++;
            }
        }
        logger.info("Router '{}' closed; {} unclaimed receiver(s) discarded", name, discarded);
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkSetupPhase() {
        if (closed) {
            throw new IllegalStateException("Router '" + name + "' is closed");
        }
        if (sealed) {
            throw new IllegalStateException("Router '" + name + "' is sealed; registration is no longer possible");
        }
    }

    private static void requireIdentity(String identity) {
        Objects.requireNonNull(identity, "identity cannot be null");
        if (identity.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be blank");
        }
    }

    @Override
    public String toString() {
        return "Router{" + name + (sealed ? ", sealed" : "") + (closed ? ", closed" : "") + "}";
    }
}
