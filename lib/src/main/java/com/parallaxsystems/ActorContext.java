package com.parallaxsystems;

import com.parallaxsystems.handler.HandlerRegistry;
import org.slf4j.Logger;

import java.util.Optional;

/**
 * Provides a restricted view of actor functionality to handlers.
 * This allows handler lambdas to reply, stop the actor or log without holding a
 * reference to the actor itself.
 */
public interface ActorContext {

    /**
     * Gets the actor processing the current message.
     *
     * @return This actor
     */
    Actor<?> self();

    String getActorId();

    /**
     * Replies to the sender of the message being processed.
     *
     * @param reply The reply value
     * @throws IllegalStateException if called outside message processing or the message has no sender
     */
    void reply(Object reply);

    /**
     * Replies to the sender of the message being processed, if it has one.
     *
     * @param reply The reply value
     * @return true if a reply was delivered
     */
    boolean replyIfExists(Object reply);

    /**
     * Gets the sender of the message being processed, if any.
     */
    Optional<Sender> getSender();

    /**
     * Stops this actor once the current message has been processed.
     */
    void stop();

    /**
     * Swaps the handler table of a dynamically dispatching actor. Takes effect from the
     * next message.
     *
     * @param registry The new handlers
     * @throws UnsupportedOperationException if the actor does not dispatch dynamically
     */
    void become(HandlerRegistry registry);

    /**
     * Gets the group this actor runs in.
     */
    ParallelGroup getGroup();

    /**
     * Gets a logger for this actor with the actor ID as context.
     */
    Logger getLogger();
}
