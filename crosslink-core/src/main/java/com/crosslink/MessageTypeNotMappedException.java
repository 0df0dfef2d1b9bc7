package com.crosslink;

/**
 * Thrown when a link exists but carries no pathway for the message type being sent.
 */
public class MessageTypeNotMappedException extends PathwayNotFoundException {

    private final String messageTypeName;

    public MessageTypeNotMappedException(String message, String link, String messageTypeName) {
        super(message, link);
        this.messageTypeName = messageTypeName;
    }

    /**
     * @return the name of the message type that had no mapping
     */
    public String getMessageTypeName() {
        return messageTypeName;
    }
}
