package com.parallaxsystems;

import com.google.common.base.Preconditions;
import com.parallaxsystems.handler.HandlerRegistry;
import com.parallaxsystems.handler.MessageHandler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BooleanSupplier;

/**
 * An actor written as a sequence of continuations.
 * <p>
 * {@link #act()} runs once when the actor starts. It registers what to do with the next
 * message through one of the {@code react} methods, and may wrap that in a {@code loop}
 * so the body runs again after every reaction:
 * <pre>{@code
 * class Echo extends LoopActor<String> {
 *     protected void act() {
 *         loop(() -> react(message -> reply(message.toUpperCase())));
 *     }
 * }
 * }</pre>
 * No thread is held while a reaction waits for its message. When the body finishes without
 * registering a reaction, and no loop iteration remains, the actor stops.
 *
 * @param <M> The type of messages this actor processes
 */
public abstract class LoopActor<M> extends Actor<M> {

    /**
     * Handles the message a reaction was waiting for.
     */
    @FunctionalInterface
    public interface Reaction<M> {
        void react(M message) throws Exception;
    }

    /**
     * A loop body or timeout action.
     */
    @FunctionalInterface
    public interface Body {
        void run() throws Exception;
    }

    /**
     * An actor body given as a lambda, for actors built by {@link ParallelGroup#actor}.
     */
    @FunctionalInterface
    public interface Definition<M> {
        void act(LoopActor<M> self) throws Exception;
    }

    private Reaction<M> pendingReaction;
    private Body pendingTimeout;
    private long reactionToken = 0L;
    private ScheduledFuture<?> timeoutFuture;

    private Body loopBody;
    private BooleanSupplier loopCondition;

    protected LoopActor() {
        super();
    }

    protected LoopActor(ParallelGroup group) {
        super(group);
    }

    protected LoopActor(ParallelGroup group, String actorId) {
        super(group, actorId);
    }

    /**
     * The actor's body, run once on its first turn.
     */
    protected abstract void act() throws Exception;

    /**
     * Runs the body now and again after every reaction, for as long as the actor lives.
     */
    public final void loop(Body body) {
        loop(() -> true, body);
    }

    /**
     * Runs the body the given number of times, resuming after every reaction.
     */
    public final void loop(int iterations, Body body) {
        Preconditions.checkArgument(iterations >= 0, "iterations must not be negative");
        int[] remaining = {iterations};
        loop(() -> remaining[0]-- > 0, body);
    }

    /**
     * Runs the body for as long as the condition holds, checked before every iteration.
     */
    public final void loop(BooleanSupplier condition, Body body) {
        checkInTurn("loop");
        Preconditions.checkNotNull(condition, "condition");
        Preconditions.checkNotNull(body, "body");
        this.loopCondition = condition;
        this.loopBody = body;
    }

    /**
     * Registers the continuation for the next message.
     *
     * @throws IllegalStateException if a reaction is already pending, or called outside the actor's turn
     */
    public final void react(Reaction<M> handler) {
        registerReaction(handler, null);
    }

    /**
     * Registers the continuation for the next message, or runs {@code onTimeout} if no
     * message arrives in time. The timeout is never delivered as a message.
     */
    public final void react(Duration timeout, Reaction<M> handler, Body onTimeout) {
        Preconditions.checkNotNull(timeout, "timeout");
        Preconditions.checkNotNull(onTimeout, "onTimeout");
        long token = registerReaction(handler, onTimeout);
        timeoutFuture = getGroup().schedule(timeout, () -> deliverTimeout(token));
    }

    /**
     * Registers a one-shot set of type-conditioned handlers for the next message.
     *
     * @throws DispatchNotFoundException when the next message matches none of them
     */
    public final void react(HandlerRegistry handlers) {
        Preconditions.checkNotNull(handlers, "handlers");
        HandlerRegistry snapshot = handlers.copy();
        react(message -> {
            MessageHandler<Object> handler = snapshot.resolve(message.getClass())
                    .orElseThrow(() -> new DispatchNotFoundException(getActorId(), message.getClass()));
            handler.handle(message, context());
        });
    }

    /**
     * Whether a reaction is waiting for a message.
     */
    protected final boolean isReacting() {
        return pendingReaction != null;
    }

    @Override
    void onActivated() throws Exception {
        act();
        continueLoop();
    }

    @Override
    protected final void receive(M message) throws Exception {
        Reaction<M> reaction = pendingReaction;
        if (reaction == null) {
            // the actor stops whenever it is left without a reaction, so this is a late arrival
            getLogger().debug("Actor {} has no pending reaction for {}", getActorId(), message);
            return;
        }
        clearReaction();
        reaction.react(message);
        continueLoop();
    }

    @Override
    void onTimeout(long token) throws Exception {
        if (token != reactionToken || pendingTimeout == null) {
            getLogger().trace("Actor {} ignoring stale timeout #{}", getActorId(), token);
            return;
        }
        Body onTimeout = pendingTimeout;
        clearReaction();
        onTimeout.run();
        continueLoop();
    }

    @Override
    void onTerminated() {
        clearReaction();
        loopBody = null;
    }

    private long registerReaction(Reaction<M> handler, Body onTimeout) {
        checkInTurn("react");
        Preconditions.checkNotNull(handler, "handler");
        Preconditions.checkState(pendingReaction == null, "Actor %s already has a pending reaction", getActorId());
        pendingReaction = handler;
        pendingTimeout = onTimeout;
        return ++reactionToken;
    }

    private void clearReaction() {
        pendingReaction = null;
        pendingTimeout = null;
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
            timeoutFuture = null;
        }
    }

    private void continueLoop() throws Exception {
        while (pendingReaction == null && isActive()) {
            if (loopBody == null || !loopCondition.getAsBoolean()) {
                loopBody = null;
                stop();
                return;
            }
            loopBody.run();
        }
    }

    private void checkInTurn(String operation) {
        if (!isInOwnTurn()) {
            throw new IllegalStateException(operation + "() may only be called from the actor's own body");
        }
    }
}
