package com.parallaxsystems;

import com.google.common.base.Preconditions;
import com.parallaxsystems.dispatcher.ActorLifecycle;
import com.parallaxsystems.dispatcher.ActorRunner;
import com.parallaxsystems.dispatcher.DispatcherMailbox;
import com.parallaxsystems.handler.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class of all actors: an identity, a mailbox and a processing loop that runs on the
 * task pool of the actor's {@link ParallelGroup}.
 * <p>
 * Messages are processed one at a time, in the order a single sender sent them, and never
 * concurrently. No thread is held while the mailbox is empty; a runner is scheduled on the
 * pool whenever work arrives.
 * <p>
 * An actor moves through {@link ActorState#NEW}, {@link ActorState#ACTIVE},
 * {@link ActorState#TERMINATING} and {@link ActorState#STOPPED}. Messages sent while NEW
 * are queued and processed after {@link #start()}. {@link #stop()} lets the message in
 * flight finish, discards the rest and runs {@link #afterStop()}. An exception escaping a
 * handler terminates the actor with that exception as its cause.
 *
 * @param <M> The type of messages this actor processes
 */
public abstract class Actor<M> implements Sender {

    private static final Logger logger = LoggerFactory.getLogger(Actor.class);

    private final String actorId;
    private final Logger actorLogger;
    private final AtomicReference<ActorState> state = new AtomicReference<>(ActorState.NEW);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final DispatcherMailbox<Envelope<M>> mailbox;
    private final ActorRunner<Envelope<M>> runner;
    private final ActorContext context = new Context();

    private volatile ParallelGroup group;
    private volatile boolean fair;
    private volatile boolean fairSetExplicitly;
    private volatile Sender supervisor;
    private volatile Throwable terminationCause;

    // set only while the actor's turn is processing an envelope
    private volatile Thread processingThread;
    private Envelope<M> currentEnvelope;

    /**
     * Creates an actor in the default group with a generated ID.
     */
    protected Actor() {
        this(Actors.defaultGroup());
    }

    /**
     * Creates an actor in the given group with a generated ID.
     *
     * @param group The group whose pool runs this actor
     */
    protected Actor(ParallelGroup group) {
        this(group, generateDefaultActorId());
    }

    /**
     * Creates an actor in the given group.
     *
     * @param group   The group whose pool runs this actor
     * @param actorId The actor ID
     */
    protected Actor(ParallelGroup group, String actorId) {
        this.group = Preconditions.checkNotNull(group, "group");
        this.actorId = Preconditions.checkNotNull(actorId, "actorId");
        this.actorLogger = LoggerFactory.getLogger(getClass().getName() + "." + actorId);
        this.fair = group.getConfig().isFairByDefault();
        this.mailbox = new DispatcherMailbox<>(group.getConfig().getMailboxType().newMailbox(), this::dispatch, actorId);
        this.runner = new ActorRunner<>(actorId, mailbox, new Lifecycle(), this::handleFailure, this::batchSize);
        logger.debug("Actor {} created in group {}", actorId, group.getName());
    }

    /**
     * Processes a received message.
     *
     * @param message the message to process
     * @throws Exception any failure, which terminates the actor
     */
    protected abstract void receive(M message) throws Exception;

    /**
     * Called on the actor's first turn, before any message is processed.
     */
    protected void afterStart() throws Exception {
        // Default implementation does nothing
    }

    /**
     * Called once the actor has stopped processing and its mailbox has been discarded.
     */
    protected void afterStop() {
        // Default implementation does nothing
    }

    /**
     * Called when a handler throws, before the actor terminates.
     *
     * @param exception The exception that escaped the handler
     */
    protected void onException(Throwable exception) {
        actorLogger.debug("Actor {} terminating after exception", actorId, exception);
    }

    // ---- lifecycle ----

    /**
     * Activates the actor. Messages queued while NEW are processed from now on.
     *
     * @return this actor
     * @throws IllegalStateException if the actor has already been started or stopped, or its
     *                               ID is taken in its group
     */
    public Actor<M> start() {
        if (state.get() != ActorState.NEW) {
            throw new IllegalStateException("Actor " + actorId + " cannot be started in state " + state.get());
        }
        group.register(this);
        if (!state.compareAndSet(ActorState.NEW, ActorState.ACTIVE)) {
            group.unregister(this);
            throw new IllegalStateException("Actor " + actorId + " cannot be started in state " + state.get());
        }
        logger.debug("Actor {} started", actorId);
        mailbox.signal();
        return this;
    }

    /**
     * Stops the actor. The message in flight completes; queued messages are discarded and
     * their waiting senders receive {@link MailboxClosedException}. Idempotent.
     */
    public void stop() {
        if (state.compareAndSet(ActorState.NEW, ActorState.STOPPED)) {
            logger.debug("Actor {} stopped before it was started", actorId);
            discardQueued();
            termination.complete(null);
            return;
        }
        if (state.compareAndSet(ActorState.ACTIVE, ActorState.TERMINATING)) {
            logger.debug("Stopping actor {}", actorId);
            mailbox.signal();
        }
    }

    /**
     * Blocks until the actor has stopped.
     *
     * @throws ActorException if the actor terminated because a handler threw
     */
    public void join() {
        try {
            termination.join();
        } catch (CompletionException e) {
            throw new ActorException("Actor " + actorId + " failed", e.getCause(), actorId);
        }
        rethrowTerminationCause();
    }

    /**
     * Blocks until the actor has stopped or the timeout expires.
     *
     * @throws TimeoutException if the actor is still running after the timeout
     * @throws ActorException   if the actor terminated because a handler threw
     */
    public void join(Duration timeout) throws TimeoutException {
        try {
            termination.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw new ActorException("Actor " + actorId + " failed", e.getCause(), actorId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorException("Interrupted while joining actor " + actorId, e, actorId);
        }
        rethrowTerminationCause();
    }

    public boolean isActive() {
        return state.get() == ActorState.ACTIVE;
    }

    public ActorState getState() {
        return state.get();
    }

    /**
     * The exception that terminated the actor, if a handler threw.
     */
    public Optional<Throwable> getTerminationCause() {
        return Optional.ofNullable(terminationCause);
    }

    // ---- messaging ----

    /**
     * Sends a message without a sender. Never blocks.
     *
     * @param message The message
     * @throws MailboxClosedException if the actor is stopping or stopped
     */
    public void send(M message) {
        send(message, null);
    }

    /**
     * Sends a message whose replies go to the given sender.
     *
     * @param message The message
     * @param sender  The reply address, or null
     * @throws MailboxClosedException if the actor is stopping or stopped
     */
    public void send(M message, Sender sender) {
        Preconditions.checkNotNull(message, "message");
        ActorState current = state.get();
        if (current == ActorState.TERMINATING || current == ActorState.STOPPED) {
            throw new MailboxClosedException(actorId);
        }
        actorLogger.trace("Actor {} received {}", actorId, message);
        mailbox.enqueue(Envelope.message(message, sender));
    }

    /**
     * Sends a message and blocks until the actor replies.
     *
     * @param message The message
     * @param <R>     The reply type
     * @return The reply
     * @throws MailboxClosedException if the message was discarded by a stop
     * @throws ActorException         if processing the message failed
     */
    public <R> R sendAndWait(M message) {
        FutureSender<R> sender = new FutureSender<>();
        send(message, sender);
        try {
            return sender.future().join();
        } catch (CompletionException e) {
            throw asActorException(e.getCause());
        }
    }

    /**
     * Sends a message and blocks until the actor replies or the timeout expires.
     *
     * @throws TimeoutException if no reply arrives in time
     */
    public <R> R sendAndWait(M message, Duration timeout) throws TimeoutException {
        FutureSender<R> sender = new FutureSender<>();
        send(message, sender);
        try {
            return sender.future().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw asActorException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActorException("Interrupted while waiting for reply from " + actorId, e, actorId);
        }
    }

    /**
     * Sends a message and returns the eventual reply without blocking.
     */
    public <R> Reply<R> ask(M message) {
        FutureSender<R> sender = new FutureSender<>();
        send(message, sender);
        return Reply.from(sender.future());
    }

    /**
     * Replies to the sender of the message being processed.
     *
     * @throws IllegalStateException if called outside message processing or the message has no sender
     */
    public void reply(Object reply) {
        Preconditions.checkNotNull(reply, "reply");
        Sender sender = requireCurrentEnvelope("reply").sender();
        if (sender == null) {
            throw new IllegalStateException("Message being processed by " + actorId + " has no sender");
        }
        sender.deliverReply(reply);
    }

    /**
     * Replies to the sender of the message being processed, if there is one.
     *
     * @return true if a reply was delivered
     */
    public boolean replyIfExists(Object reply) {
        Preconditions.checkNotNull(reply, "reply");
        Sender sender = requireCurrentEnvelope("replyIfExists").sender();
        if (sender == null) {
            return false;
        }
        sender.deliverReply(reply);
        return true;
    }

    /**
     * The sender of the message being processed, if any.
     *
     * @throws IllegalStateException if called outside message processing
     */
    public Optional<Sender> getSender() {
        return Optional.ofNullable(requireCurrentEnvelope("getSender").sender());
    }

    /**
     * Replies addressed to an actor are delivered to it as ordinary messages.
     * The reply must be of the actor's message type. Replies to a stopped actor are dropped.
     */
    @Override
    @SuppressWarnings("unchecked")
    public void deliverReply(Object reply) {
        try {
            send((M) reply);
        } catch (MailboxClosedException e) {
            logger.debug("Dropping reply {} to stopped actor {}", reply, actorId);
        }
    }

    @Override
    public void deliverFailure(Throwable cause) {
        actorLogger.debug("Actor {} was told a message it sent failed", actorId, cause);
    }

    // ---- configuration ----

    /**
     * Makes the actor yield its worker after {@link com.parallaxsystems.pool.PoolConfig#getFairBatchSize()}
     * messages instead of draining its mailbox. May be changed at any time.
     */
    public Actor<M> setFair(boolean fair) {
        this.fair = fair;
        this.fairSetExplicitly = true;
        return this;
    }

    public Actor<M> makeFair() {
        return setFair(true);
    }

    public boolean isFair() {
        return fair;
    }

    /**
     * Moves the actor to another group. Only allowed before the actor is started.
     * <p>
     * Unless {@link #setFair(boolean)} was called, fairness follows the new group's
     * fair-by-default setting. The mailbox, and any messages already queued in it, stay
     * with the actor, so its mailbox type remains the one of the group it was created in.
     *
     * @throws IllegalStateException if the actor is no longer NEW
     */
    public Actor<M> setParallelGroup(ParallelGroup group) {
        Preconditions.checkNotNull(group, "group");
        Preconditions.checkState(state.get() == ActorState.NEW,
                "Parallel group of actor %s can only be changed before it starts", actorId);
        this.group = group;
        if (!fairSetExplicitly) {
            this.fair = group.getConfig().isFairByDefault();
        }
        return this;
    }

    /**
     * Sets the sender notified with an {@link ActorFailure} if this actor fails.
     */
    public Actor<M> withSupervisor(Sender supervisor) {
        this.supervisor = supervisor;
        return this;
    }

    public String getActorId() {
        return actorId;
    }

    public ParallelGroup getGroup() {
        return group;
    }

    /**
     * Gets a logger for this actor with the actor ID as context.
     */
    public Logger getLogger() {
        return actorLogger;
    }

    /**
     * Number of messages waiting in the mailbox.
     */
    public int getMailboxSize() {
        return mailbox.size();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + actorId + ", " + state.get() + "]";
    }

    // ---- internals shared with subclasses in this package ----

    /**
     * The context handed to handler lambdas.
     */
    protected final ActorContext context() {
        return context;
    }

    /**
     * Whether the calling thread is this actor's turn.
     */
    protected final boolean isInOwnTurn() {
        return processingThread == Thread.currentThread();
    }

    /**
     * Runs an action on this actor's turn: immediately when already inside it, otherwise
     * queued behind the messages already in the mailbox.
     */
    final void runInTurn(Runnable action) {
        if (isInOwnTurn()) {
            action.run();
            return;
        }
        ActorState current = state.get();
        if (current == ActorState.TERMINATING || current == ActorState.STOPPED) {
            throw new MailboxClosedException(actorId);
        }
        mailbox.enqueue(Envelope.task(action));
    }

    /**
     * Queues a timeout signal for the reaction identified by the token.
     */
    final void deliverTimeout(long token) {
        if (state.get() == ActorState.ACTIVE) {
            mailbox.enqueue(Envelope.timeout(token));
        }
    }

    /**
     * Called on the actor's first turn, after {@link #afterStart()}.
     */
    void onActivated() throws Exception {
        // nothing by default
    }

    /**
     * Called with a timeout signal; stale tokens must be ignored.
     */
    void onTimeout(long token) throws Exception {
        // nothing by default
    }

    /**
     * Called once when the actor reaches STOPPED, before {@link #afterStop()}.
     */
    void onTerminated() {
        // nothing by default
    }

    void switchHandlers(HandlerRegistry registry) {
        throw new UnsupportedOperationException("Actor " + actorId + " does not dispatch dynamically");
    }

    static String generateDefaultActorId() {
        return UUID.randomUUID().toString();
    }

    // ---- processing ----

    private void dispatch() {
        if (state.get() == ActorState.NEW) {
            // queued before start(); start() signals again
            mailbox.tryClearScheduled();
            if (state.get() != ActorState.NEW) {
                mailbox.signal();
            }
            return;
        }
        group.getPool().execute(runner);
    }

    private int batchSize() {
        return fair ? group.getConfig().getFairBatchSize() : Integer.MAX_VALUE;
    }

    private void process(Envelope<M> envelope) throws Exception {
        processingThread = Thread.currentThread();
        currentEnvelope = envelope;
        try {
            switch (envelope.kind()) {
                case MESSAGE:
                    receive(envelope.message());
                    break;
                case TIMEOUT:
                    onTimeout(envelope.token());
                    break;
                case TASK:
                    envelope.task().run();
                    break;
                default:
                    throw new IllegalStateException("Unknown envelope kind " + envelope.kind());
            }
        } finally {
            currentEnvelope = null;
            processingThread = null;
        }
    }

    private void activate() throws Exception {
        processingThread = Thread.currentThread();
        try {
            afterStart();
            onActivated();
        } finally {
            processingThread = null;
        }
    }

    private void handleFailure(Envelope<M> envelope, Throwable cause) {
        try {
            onException(cause);
        } catch (Throwable hookError) {
            actorLogger.error("onException hook of actor {} failed", actorId, hookError);
        }
        terminationCause = cause;
        state.compareAndSet(ActorState.ACTIVE, ActorState.TERMINATING);

        Object message = envelope != null ? envelope.message() : null;
        if (envelope != null && envelope.sender() != null) {
            envelope.sender().deliverFailure(
                    new ActorException("Actor " + actorId + " failed processing " + envelope, cause, actorId));
        }
        Sender currentSupervisor = supervisor;
        if (currentSupervisor != null) {
            try {
                currentSupervisor.deliverReply(new ActorFailure(actorId, message, cause));
            } catch (RuntimeException e) {
                logger.warn("Could not notify supervisor of actor {}", actorId, e);
            }
        }
    }

    private void terminate() {
        if (!state.compareAndSet(ActorState.TERMINATING, ActorState.STOPPED)) {
            // messages that slipped in after the stop
            discardQueued();
            return;
        }
        int discarded = discardQueued();
        if (discarded > 0) {
            logger.debug("Actor {} discarded {} queued messages on stop", actorId, discarded);
        }
        try {
            onTerminated();
            afterStop();
        } catch (Throwable e) {
            actorLogger.error("afterStop hook of actor {} failed", actorId, e);
        }
        group.unregister(this);
        logger.debug("Actor {} stopped", actorId);
        termination.complete(null);
    }

    private int discardQueued() {
        int count = 0;
        Envelope<M> envelope;
        while ((envelope = mailbox.poll()) != null) {
            count++;
            if (envelope.sender() != null) {
                envelope.sender().deliverFailure(new MailboxClosedException(actorId));
            }
        }
        return count;
    }

    private Envelope<M> requireCurrentEnvelope(String operation) {
        Envelope<M> envelope = isInOwnTurn() ? currentEnvelope : null;
        if (envelope == null || envelope.kind() != Envelope.Kind.MESSAGE) {
            throw new IllegalStateException(operation + "() called outside message processing of actor " + actorId);
        }
        return envelope;
    }

    private void rethrowTerminationCause() {
        Throwable cause = terminationCause;
        if (cause != null) {
            throw new ActorException("Actor " + actorId + " terminated with a failure", cause, actorId);
        }
    }

    private ActorException asActorException(Throwable cause) {
        if (cause instanceof ActorException) {
            return (ActorException) cause;
        }
        return new ActorException("Message to actor " + actorId + " failed", cause, actorId);
    }

    private final class Lifecycle implements ActorLifecycle<Envelope<M>> {
        @Override
        public void preStart() throws Exception {
            activate();
        }

        @Override
        public void receive(Envelope<M> item) throws Exception {
            process(item);
        }

        @Override
        public boolean isActive() {
            return state.get() == ActorState.ACTIVE;
        }

        @Override
        public boolean isTerminating() {
            return state.get() == ActorState.TERMINATING;
        }

        @Override
        public void postStop() {
            terminate();
        }
    }

    private final class Context implements ActorContext {
        @Override
        public Actor<?> self() {
            return Actor.this;
        }

        @Override
        public String getActorId() {
            return actorId;
        }

        @Override
        public void reply(Object reply) {
            Actor.this.reply(reply);
        }

        @Override
        public boolean replyIfExists(Object reply) {
            return Actor.this.replyIfExists(reply);
        }

        @Override
        public Optional<Sender> getSender() {
            return Actor.this.getSender();
        }

        @Override
        public void stop() {
            Actor.this.stop();
        }

        @Override
        public void become(HandlerRegistry registry) {
            switchHandlers(registry);
        }

        @Override
        public ParallelGroup getGroup() {
            return group;
        }

        @Override
        public Logger getLogger() {
            return actorLogger;
        }
    }
}
