package com.crosslink;

/**
 * Thrown when an identity or dispatch key is registered a second time on the same side.
 */
public class DuplicateRegistrationException extends RegistrationException {

    public DuplicateRegistrationException(String message, String subject) {
        super(message, subject);
    }
}
