package com.parallaxsystems.dispatcher;

/**
 * Callbacks an {@link ActorRunner} drives on behalf of one actor.
 *
 * @param <T> the type of queued items
 */
public interface ActorLifecycle<T> {

    /** Called once, on the first turn after activation. */
    void preStart() throws Exception;

    /** Processes one dequeued item. */
    void receive(T item) throws Exception;

    /** Whether the actor is still accepting and processing messages. */
    boolean isActive();

    /** Whether the actor has been asked to stop but has not finished stopping. */
    boolean isTerminating();

    /** Finishes termination: discards what is left in the mailbox and runs stop hooks. */
    void postStop();
}
