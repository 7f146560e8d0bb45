package com.parallaxsystems;

import com.google.common.base.Preconditions;
import com.parallaxsystems.handler.MessageHandler;

/**
 * An actor with a single handler bound to one declared message type. The type is checked
 * by the compiler, so no runtime inspection happens per message.
 * <p>
 * Either pass a handler, or subclass and override {@link #onMessage}.
 *
 * @param <T> The declared message type
 */
public class StaticDispatchActor<T> extends Actor<T> {

    private final Class<T> messageType;
    private final MessageHandler<? super T> handler;

    public StaticDispatchActor(Class<T> messageType, MessageHandler<? super T> handler) {
        super();
        this.messageType = Preconditions.checkNotNull(messageType, "messageType");
        this.handler = Preconditions.checkNotNull(handler, "handler");
    }

    public StaticDispatchActor(ParallelGroup group, Class<T> messageType, MessageHandler<? super T> handler) {
        super(group);
        this.messageType = Preconditions.checkNotNull(messageType, "messageType");
        this.handler = Preconditions.checkNotNull(handler, "handler");
    }

    /**
     * For subclasses overriding {@link #onMessage}.
     */
    protected StaticDispatchActor(ParallelGroup group, String actorId, Class<T> messageType) {
        super(group, actorId);
        this.messageType = Preconditions.checkNotNull(messageType, "messageType");
        this.handler = null;
    }

    public Class<T> getMessageType() {
        return messageType;
    }

    /**
     * Handles one message. Delegates to the handler given at construction.
     */
    protected void onMessage(T message, ActorContext context) throws Exception {
        if (handler == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " must override onMessage()");
        }
        handler.handle(message, context);
    }

    @Override
    protected final void receive(T message) throws Exception {
        onMessage(message, context());
    }
}
