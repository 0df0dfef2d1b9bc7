package com.crosslink;

/**
 * Thrown when no sender or receiver is registered under the requested identity or key.
 */
public class PathwayNotFoundException extends CommsException {

    public PathwayNotFoundException(String message, String subject) {
        super(message, subject);
    }
}
