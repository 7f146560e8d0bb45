package com.parallaxsystems;

import com.parallaxsystems.handler.HandlerRegistry;
import com.parallaxsystems.handler.MessageHandler;
import com.parallaxsystems.pool.PoolConfig;

import java.util.function.Function;

/**
 * Factory methods creating actors in a process-wide default group. The default group is
 * created on first use with daemon workers, one per available processor.
 */
public final class Actors {

    private static final String DEFAULT_GROUP_NAME = "parallax-default";

    private static ParallelGroup defaultGroup;

    private Actors() {
    }

    public static synchronized ParallelGroup defaultGroup() {
        if (defaultGroup == null || defaultGroup.isShutdown()) {
            defaultGroup = new ParallelGroup(new PoolConfig().setName(DEFAULT_GROUP_NAME));
        }
        return defaultGroup;
    }

    /**
     * Shuts the default group down. The next use creates a fresh one.
     */
    public static synchronized void shutdownDefaultGroup() {
        if (defaultGroup != null) {
            defaultGroup.shutdown();
            defaultGroup = null;
        }
    }

    public static <M> LoopActor<M> actor(LoopActor.Definition<M> definition) {
        return defaultGroup().actor(definition);
    }

    public static DynamicDispatchActor messageHandler(HandlerRegistry handlers) {
        return defaultGroup().messageHandler(handlers);
    }

    public static <T> StaticDispatchActor<T> staticMessageHandler(Class<T> messageType, MessageHandler<? super T> handler) {
        return defaultGroup().staticMessageHandler(messageType, handler);
    }

    public static <T, R> ReactiveActor<T, R> reactor(Function<? super T, ? extends R> function) {
        return defaultGroup().reactor(function);
    }
}
