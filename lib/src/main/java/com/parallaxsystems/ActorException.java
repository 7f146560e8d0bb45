package com.parallaxsystems;

/**
 * Failure raised by or on behalf of one actor.
 * Thrown by {@link Actor#join()} for an actor that terminated with a failure, and
 * delivered to a waiting sender when processing its message failed.
 */
public class ActorException extends RuntimeException {

    private final String actorId;

    public ActorException(String message, String actorId) {
        super(message);
        this.actorId = actorId;
    }

    public ActorException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * @return the ID of the actor the failure belongs to
     */
    public String getActorId() {
        return actorId;
    }
}
