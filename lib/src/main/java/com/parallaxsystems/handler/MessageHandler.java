package com.parallaxsystems.handler;

import com.parallaxsystems.ActorContext;

/**
 * Handles one message on behalf of an actor. Invoked on the actor's turn, so
 * implementations never run concurrently for the same actor.
 *
 * @param <T> the message type
 */
@FunctionalInterface
public interface MessageHandler<T> {

    /**
     * @param message the message being processed
     * @param context the processing actor's view of itself
     * @throws Exception any failure; it terminates the actor
     */
    void handle(T message, ActorContext context) throws Exception;
}
