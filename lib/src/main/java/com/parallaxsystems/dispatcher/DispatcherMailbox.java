package com.parallaxsystems.dispatcher;

import com.parallaxsystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DispatcherMailbox wraps an actor's {@link Mailbox} and implements coalesced scheduling:
 * the schedule action runs only when the "scheduled" flag flips from false to true, so at
 * most one runner per actor is ever queued on the pool.
 *
 * @param <T> The type of messages in the mailbox
 */
public final class DispatcherMailbox<T> {

    private static final Logger logger = LoggerFactory.getLogger(DispatcherMailbox.class);

    private final Mailbox<T> queue;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final Runnable scheduleAction;
    private final String actorId;

    /**
     * @param queue          The underlying message queue
     * @param scheduleAction The action that hands the actor's runner to the pool
     * @param actorId        The actor ID for logging
     */
    public DispatcherMailbox(Mailbox<T> queue, Runnable scheduleAction, String actorId) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.scheduleAction = Objects.requireNonNull(scheduleAction, "scheduleAction");
        this.actorId = actorId;
    }

    /**
     * Enqueues a message and schedules the actor unless a runner is already pending.
     *
     * @param message The message to enqueue
     */
    public void enqueue(T message) {
        Objects.requireNonNull(message, "message cannot be null");
        queue.offer(message);
        signal();
    }

    /**
     * Schedules the actor's runner if none is pending, without enqueuing anything.
     * Used on start and stop, and by a runner that finds more work after its batch.
     */
    public void signal() {
        if (scheduled.compareAndSet(false, true)) {
            try {
                scheduleAction.run();
            } catch (Throwable t) {
                // Protect enqueue callers from scheduler exceptions
                logger.error("Actor {} schedule action failed", actorId, t);
                scheduled.set(false);
            }
        }
    }

    /**
     * Polls a message from the mailbox (consumer side).
     *
     * @return The next message, or null if empty
     */
    public T poll() {
        return queue.poll();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    /**
     * Attempts to clear the scheduled flag after processing a batch.
     *
     * @return true if cleared, false if already false
     */
    public boolean tryClearScheduled() {
        return scheduled.compareAndSet(true, false);
    }

    public boolean isScheduled() {
        return scheduled.get();
    }
}
