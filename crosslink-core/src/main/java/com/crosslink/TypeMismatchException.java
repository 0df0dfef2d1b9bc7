package com.crosslink;

/**
 * Thrown when the type registered for an identity differs from the type a caller
 * sends or expects to receive. Always indicates a wiring bug in setup code.
 */
public class TypeMismatchException extends CommsException {

    private final String registeredType;
    private final String requestedType;

    public TypeMismatchException(String message, String subject, String registeredType, String requestedType) {
        super(message, subject);
        this.registeredType = registeredType;
        this.requestedType = requestedType;
    }

    public String getRegisteredType() {
        return registeredType;
    }

    public String getRequestedType() {
        return requestedType;
    }
}
