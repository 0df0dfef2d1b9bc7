package com.crosslink;

/**
 * Thrown when a link-addressed send names a link nothing was registered for.
 */
public class LinkNotFoundException extends CommsException {

    public LinkNotFoundException(String message, String link) {
        super(message, link);
    }
}
