package com.crosslink;

/**
 * Setup-time failure: the registration being attempted would leave the router in a
 * structurally invalid state. These are configuration errors and are normally fatal
 * for the application that triggers them.
 */
public abstract class RegistrationException extends CommsException {

    protected RegistrationException(String message, String subject) {
        super(message, subject);
    }
}
