package com.crosslink;

/**
 * Thrown when a message type would map to more than one pathway on the same link,
 * either while registering or when a send cannot pick a single pathway.
 */
public class AmbiguousDispatchException extends RegistrationException {

    public AmbiguousDispatchException(String message, String link) {
        super(message, link);
    }
}
