package com.crosslink;

/**
 * Thrown when an invariant that earlier type checks guarantee turns out to be violated,
 * e.g. a payload that passed tag verification fails its downcast. Should never happen.
 */
public class InternalInconsistencyException extends CommsException {

    public InternalInconsistencyException(String message, String subject) {
        super(message, subject);
    }

    public InternalInconsistencyException(String message, String subject, Throwable cause) {
        super(message, subject, cause);
    }
}
