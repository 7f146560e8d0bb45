package com.parallaxsystems.dispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.IntSupplier;

/**
 * ActorRunner processes messages from a DispatcherMailbox in batches, one turn per
 * activation on the pool.
 * <p>
 * A fair actor's batch is small, so it yields its worker to other actors after a few
 * messages; a non-fair actor drains whatever is queued. After the batch the runner clears
 * the scheduled flag and re-checks the mailbox, so messages that arrived during the turn
 * are never stranded. When the actor stops being active the runner finishes termination
 * in the same turn.
 *
 * @param <T> The type of queued items
 */
public final class ActorRunner<T> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ActorRunner.class);

    private final String actorId;
    private final DispatcherMailbox<T> mailbox;
    private final ActorLifecycle<T> lifecycle;
    private final BiConsumer<T, Throwable> exceptionHandler;
    private final IntSupplier throughput;

    // touched only by the thread running the current turn; turns are ordered by the scheduled flag
    private boolean started = false;

    /**
     * @param actorId          The ID of the actor for logging
     * @param mailbox          The dispatcher mailbox to process messages from
     * @param lifecycle        The actor lifecycle callbacks
     * @param exceptionHandler Handler for processing errors; the item is null for start failures
     * @param throughput       Maximum number of messages to process per activation
     */
    public ActorRunner(
            String actorId,
            DispatcherMailbox<T> mailbox,
            ActorLifecycle<T> lifecycle,
            BiConsumer<T, Throwable> exceptionHandler,
            IntSupplier throughput) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.exceptionHandler = Objects.requireNonNull(exceptionHandler, "exceptionHandler");
        this.throughput = Objects.requireNonNull(throughput, "throughput");
    }

    @Override
    public void run() {
        try {
            if (!started && lifecycle.isActive()) {
                started = true;
                try {
                    lifecycle.preStart();
                } catch (Throwable t) {
                    fail(null, t);
                }
            }

            int limit = Math.max(1, throughput.getAsInt());
            int processed = 0;
            T msg;
            while (processed < limit && lifecycle.isActive() && (msg = mailbox.poll()) != null) {
                try {
                    lifecycle.receive(msg);
                } catch (Throwable t) {
                    fail(msg, t);
                }
                processed++;
            }

            if (processed > 0) {
                logger.trace("Actor {} processed {} messages", actorId, processed);
            }

            if (!lifecycle.isActive()) {
                lifecycle.postStop();
            }
        } finally {
            // Clear the flag, then look again: anything that arrived during the turn
            // found the flag set and relied on us to schedule it
            if (mailbox.tryClearScheduled() && (lifecycle.isTerminating() || !mailbox.isEmpty())) {
                mailbox.signal();
            }
        }
    }

    private void fail(T msg, Throwable t) {
        logger.error("Actor {} error processing message: {}", actorId, msg, t);
        try {
            exceptionHandler.accept(msg, t);
        } catch (Throwable handlerError) {
            logger.error("Actor {} exception handler failed", actorId, handlerError);
        }
    }

    public String getActorId() {
        return actorId;
    }
}
