package com.crosslink;

/**
 * Thrown when a message cannot be delivered because the consuming end of its pathway
 * has been closed. Signals that the peer has shut down; the message was not enqueued.
 */
public class SendFailedException extends CommsException {

    public SendFailedException(String message) {
        super(message);
    }

    public SendFailedException(String message, String subject) {
        super(message, subject);
    }

    public SendFailedException(String message, String subject, Throwable cause) {
        super(message, subject, cause);
    }
}
