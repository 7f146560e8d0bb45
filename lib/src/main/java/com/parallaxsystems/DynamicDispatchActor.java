package com.parallaxsystems;

import com.google.common.base.Preconditions;
import com.parallaxsystems.handler.HandlerRegistry;
import com.parallaxsystems.handler.MessageHandler;

/**
 * An actor that picks the handler for each message from its runtime type.
 * <p>
 * The most specific registered type wins; equally specific registrations resolve in
 * favour of the later one, so {@link #when} can override handlers given at construction.
 * Messages matching nothing go to the {@code otherwise} handler, or terminate the actor
 * with a {@link DispatchNotFoundException} when there is none.
 */
public class DynamicDispatchActor extends Actor<Object> {

    private volatile HandlerRegistry handlers;

    public DynamicDispatchActor() {
        this(HandlerRegistry.create());
    }

    public DynamicDispatchActor(HandlerRegistry handlers) {
        super();
        this.handlers = Preconditions.checkNotNull(handlers, "handlers").copy();
    }

    public DynamicDispatchActor(ParallelGroup group, HandlerRegistry handlers) {
        super(group);
        this.handlers = Preconditions.checkNotNull(handlers, "handlers").copy();
    }

    public DynamicDispatchActor(ParallelGroup group, String actorId, HandlerRegistry handlers) {
        super(group, actorId);
        this.handlers = Preconditions.checkNotNull(handlers, "handlers").copy();
    }

    /**
     * Adds a handler. It takes precedence over an earlier one for the same type.
     */
    public <T> DynamicDispatchActor when(Class<T> type, MessageHandler<? super T> handler) {
        handlers.when(type, handler);
        return this;
    }

    /**
     * Sets the catch-all handler.
     */
    public DynamicDispatchActor otherwise(MessageHandler<Object> handler) {
        handlers.otherwise(handler);
        return this;
    }

    /**
     * Replaces the whole handler table. Called from a handler, the swap happens at once
     * and applies from the next message; called from outside, it is queued behind the
     * messages already waiting.
     */
    public void become(HandlerRegistry registry) {
        switchHandlers(registry);
    }

    @Override
    void switchHandlers(HandlerRegistry registry) {
        HandlerRegistry replacement = Preconditions.checkNotNull(registry, "registry").copy();
        runInTurn(() -> {
            getLogger().debug("Actor {} switching to {} handlers", getActorId(), replacement.size());
            this.handlers = replacement;
        });
    }

    @Override
    protected void receive(Object message) throws Exception {
        MessageHandler<Object> handler = handlers.resolve(message.getClass())
                .orElseThrow(() -> new DispatchNotFoundException(getActorId(), message.getClass()));
        handler.handle(message, context());
    }
}
