package com.parallaxsystems.mailbox;

import java.util.Collection;

/**
 * Abstraction for actor mailbox operations.
 * This interface decouples the actor runtime from specific queue implementations.
 * <p>
 * Mailboxes are unbounded and never block: producers enqueue from any thread, and
 * exactly one consumer (the owning actor's runner) dequeues at a time.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Appends the specified message to the tail of this mailbox.
     *
     * @param message the message to add
     * @return true if the message was added
     * @throws NullPointerException if the message is null
     */
    boolean offer(T message);

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Removes up to {@code maxElements} messages from this mailbox and adds them to the
     * given collection, preserving mailbox order.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * Returns the number of messages in this mailbox.
     * Concurrent implementations may return an estimate.
     *
     * @return the number of messages
     */
    int size();

    /**
     * Returns true if this mailbox contains no messages.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Removes all messages from this mailbox.
     */
    void clear();
}
