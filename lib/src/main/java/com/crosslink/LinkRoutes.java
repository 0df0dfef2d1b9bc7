package com.crosslink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The message types mapped on one link and the pathway each one selects.
 * Mutated only during setup; {@link #freeze()} returns an immutable copy.
 */
final class LinkRoutes {

    /** One mapping of a type to the pathway carrying it. */
    record Route(MessageType<?> messageType, DispatchKey key) {
    }

    private final String link;
    private final Map<Class<?>, List<Route>> routesByClass;

    LinkRoutes(String link) {
        this(link, new LinkedHashMap<>());
    }

    private LinkRoutes(String link, Map<Class<?>, List<Route>> routesByClass) {
        this.link = link;
        this.routesByClass = routesByClass;
    }

    /**
     * Maps a type to a pathway. The table is left untouched if the mapping is rejected.
     *
     * @throws AmbiguousDispatchException if the type is already mapped on this link (per
     *         direction when {@code directionQualified})
     */
    void add(MessageType<?> messageType, DispatchKey key, boolean directionQualified) {
        for (Route existing : routesByClass.getOrDefault(messageType.javaType(), List.of())) {
            if (!directionQualified || existing.key().source().equals(key.source())) {
                throw new AmbiguousDispatchException("Message type " + messageType + " is already mapped on link '"
                        + link + "' to " + existing.key() + "; cannot also map it to " + key, link);
            }
        }
        routesByClass.computeIfAbsent(messageType.javaType(), c -> new ArrayList<>()).add(new Route(messageType, key));
    }

    /**
     * Selects the pathway for a payload.
     *
     * @param message the payload
     * @param source the sending endpoint, or null to select by type alone
     * @return the route to use
     * @throws MessageTypeNotMappedException if no mapping matches
     * @throws AmbiguousDispatchException if more than one mapping matches
     */
    Route resolve(Object message, String source) {
        List<Route> candidates = filter(routesByClass.getOrDefault(message.getClass(), List.of()), source);
        if (candidates.isEmpty()) {
            // Mappings for a supertype (e.g. a sealed interface) also accept the payload
            List<Route> inherited = new ArrayList<>();
            for (Map.Entry<Class<?>, List<Route>> entry : routesByClass.entrySet()) {
                if (entry.getKey() != message.getClass() && entry.getKey().isInstance(message)) {
                    inherited.addAll(entry.getValue());
                }
            }
            candidates = filter(inherited, source);
        }

        if (candidates.isEmpty()) {
            String typeName = message.getClass().getName();
            String from = source == null ? "" : " from '" + source + "'";
            throw new MessageTypeNotMappedException(
                    "No pathway on link '" + link + "' carries " + typeName + from, link, typeName);
        }
        if (candidates.size() > 1) {
            List<DispatchKey> keys = new ArrayList<>();
            candidates.forEach(route -> keys.add(route.key()));
            throw new AmbiguousDispatchException("Message of type " + message.getClass().getName()
                    + " matches several pathways on link '" + link + "': " + keys
                    + (source == null ? "; name the source endpoint" : ""), link);
        }
        return candidates.get(0);
    }

    private static List<Route> filter(List<Route> routes, String source) {
        if (source == null) {
            return routes;
        }
        List<Route> matching = new ArrayList<>(routes.size());
        for (Route route : routes) {
            if (route.key().source().equals(source)) {
                matching.add(route);
            }
        }
        return matching;
    }

    LinkRoutes freeze() {
        Map<Class<?>, List<Route>> copy = new LinkedHashMap<>();
        routesByClass.forEach((type, routes) -> copy.put(type, List.copyOf(routes)));
        return new LinkRoutes(link, Collections.unmodifiableMap(copy));
    }
}
