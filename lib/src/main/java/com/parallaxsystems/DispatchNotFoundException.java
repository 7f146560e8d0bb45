package com.parallaxsystems;

/**
 * Thrown when a dynamically dispatched message matches no registered handler and no
 * catch-all handler is present.
 */
public class DispatchNotFoundException extends ActorException {

    private final Class<?> messageType;

    public DispatchNotFoundException(String actorId, Class<?> messageType) {
        super("Actor " + actorId + " has no handler for messages of type " + messageType.getName(), actorId);
        this.messageType = messageType;
    }

    public Class<?> getMessageType() {
        return messageType;
    }
}
