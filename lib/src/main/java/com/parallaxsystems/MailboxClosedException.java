package com.parallaxsystems;

/**
 * Thrown when a message is sent to an actor that is stopping or stopped, and delivered
 * to callers waiting on a message that was discarded by {@link Actor#stop()}.
 */
public class MailboxClosedException extends ActorException {

    public MailboxClosedException(String actorId) {
        super("Mailbox of actor " + actorId + " is closed", actorId);
    }
}
