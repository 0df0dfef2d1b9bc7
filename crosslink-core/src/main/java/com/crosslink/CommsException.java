package com.crosslink;

/**
 * Base class for every failure raised by the Crosslink router and its pathways.
 * <p>
 * Subclasses identify the failure kind; callers that only care whether messaging
 * failed can catch this type, callers that react differently per kind catch the
 * concrete subclass.
 */
public class CommsException extends RuntimeException {

    /** The identity, link or dispatch key the failure relates to, if known. */
    private final String subject;

    /**
     * Creates a new CommsException with the specified detail message.
     *
     * @param message the detail message
     */
    public CommsException(String message) {
        this(message, null, null);
    }

    /**
     * Creates a new CommsException with the specified detail message and subject.
     *
     * @param message the detail message
     * @param subject the identity, link or key involved
     */
    public CommsException(String message, String subject) {
        this(message, subject, null);
    }

    /**
     * Creates a new CommsException with the specified detail message, subject and cause.
     *
     * @param message the detail message
     * @param subject the identity, link or key involved
     * @param cause the cause of the exception
     */
    public CommsException(String message, String subject, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    /**
     * Returns the identity, link name or dispatch key the failure relates to.
     *
     * @return the subject, or null if not specified
     */
    public String getSubject() {
        return subject;
    }
}
