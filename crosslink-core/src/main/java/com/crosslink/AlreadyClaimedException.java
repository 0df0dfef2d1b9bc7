package com.crosslink;

/**
 * Thrown when a receiver that has already been handed out is claimed again.
 */
public class AlreadyClaimedException extends CommsException {

    public AlreadyClaimedException(String message, String identity) {
        super(message, identity);
    }
}
