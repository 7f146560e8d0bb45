package com.parallaxsystems;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.parallaxsystems.handler.HandlerRegistry;
import com.parallaxsystems.handler.MessageHandler;
import com.parallaxsystems.pool.PoolConfig;
import com.parallaxsystems.pool.TaskPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * A named binding of a {@link TaskPool} that actors run on, together with a timer for
 * receive timeouts and delayed sends, and a registry of the group's live actors.
 * <p>
 * Groups created from a {@link PoolConfig} own their pool and shut it down with the group.
 * A group wrapping an existing pool leaves the pool running.
 */
public class ParallelGroup implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ParallelGroup.class);

    private final String name;
    private final TaskPool pool;
    private final boolean ownsPool;
    private final ScheduledThreadPoolExecutor timer;
    private final Map<String, Actor<?>> actors = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public ParallelGroup() {
        this(new PoolConfig());
    }

    public ParallelGroup(int parallelism) {
        this(PoolConfig.withParallelism(parallelism));
    }

    public ParallelGroup(PoolConfig config) {
        this(config.getName(), new TaskPool(config), true);
    }

    /**
     * Creates a group on a pool owned by someone else.
     *
     * @param name The group name
     * @param pool The pool to run actors on
     */
    public ParallelGroup(String name, TaskPool pool) {
        this(name, pool, false);
    }

    private ParallelGroup(String name, TaskPool pool, boolean ownsPool) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.pool = Preconditions.checkNotNull(pool, "pool");
        this.ownsPool = ownsPool;
        this.timer = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
                .setNameFormat(name + "-timer-%d")
                .setDaemon(true)
                .build());
        this.timer.setRemoveOnCancelPolicy(true);
        logger.debug("ParallelGroup {} created on pool with {} workers", name, pool.getParallelism());
    }

    // ---- actor factories ----

    /**
     * Creates and starts a loop actor whose body is the given definition.
     * <pre>{@code
     * LoopActor<String> echo = group.actor(self ->
     *         self.loop(() -> self.react(message -> self.reply(message))));
     * }</pre>
     */
    public <M> LoopActor<M> actor(LoopActor.Definition<M> definition) {
        Preconditions.checkNotNull(definition, "definition");
        LoopActor<M> actor = new LoopActor<M>(this) {
            @Override
            protected void act() throws Exception {
                definition.act(this);
            }
        };
        actor.start();
        return actor;
    }

    /**
     * Creates and starts an actor dispatching on message type.
     */
    public DynamicDispatchActor messageHandler(HandlerRegistry handlers) {
        DynamicDispatchActor actor = new DynamicDispatchActor(this, handlers);
        actor.start();
        return actor;
    }

    /**
     * Creates and starts an actor with one handler for one declared type.
     */
    public <T> StaticDispatchActor<T> staticMessageHandler(Class<T> messageType, MessageHandler<? super T> handler) {
        StaticDispatchActor<T> actor = new StaticDispatchActor<>(this, messageType, handler);
        actor.start();
        return actor;
    }

    /**
     * Creates and starts an actor replying to every message with {@code function(message)}.
     */
    public <T, R> ReactiveActor<T, R> reactor(Function<? super T, ? extends R> function) {
        ReactiveActor<T, R> actor = new ReactiveActor<>(this, function);
        actor.start();
        return actor;
    }

    /**
     * Sends a message to an actor after a delay. A target that has stopped by then is skipped.
     *
     * @return a future that can cancel the send
     */
    public <M> ScheduledFuture<?> sendAfter(Actor<M> target, M message, Duration delay) {
        Preconditions.checkNotNull(target, "target");
        Preconditions.checkNotNull(message, "message");
        return schedule(delay, () -> {
            try {
                target.send(message);
            } catch (MailboxClosedException e) {
                logger.debug("Delayed message {} not delivered, actor {} has stopped", message, target.getActorId());
            }
        });
    }

    // ---- registry ----

    public Optional<Actor<?>> getActor(String actorId) {
        return Optional.ofNullable(actors.get(actorId));
    }

    public int getActorCount() {
        return actors.size();
    }

    void register(Actor<?> actor) {
        if (shutdown) {
            throw new IllegalStateException("ParallelGroup " + name + " has been shut down");
        }
        Actor<?> previous = actors.putIfAbsent(actor.getActorId(), actor);
        if (previous != null && previous != actor) {
            throw new IllegalStateException("Actor ID " + actor.getActorId() + " is already in use in group " + name);
        }
    }

    void unregister(Actor<?> actor) {
        actors.remove(actor.getActorId(), actor);
    }

    ScheduledFuture<?> schedule(Duration delay, Runnable action) {
        Preconditions.checkNotNull(delay, "delay");
        return timer.schedule(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.error("Scheduled action in group {} failed", name, e);
            }
        }, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    // ---- accessors ----

    public String getName() {
        return name;
    }

    public TaskPool getPool() {
        return pool;
    }

    public PoolConfig getConfig() {
        return pool.getConfig();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Stops every actor of the group, waits for them up to the configured shutdown timeout,
     * stops the timer and, if the group owns its pool, drains and shuts the pool down.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down all actors in group {}", name);

        List<Actor<?>> running = new ArrayList<>(actors.values());
        for (Actor<?> actor : running) {
            actor.stop();
        }
        Duration timeout = Duration.ofSeconds(getConfig().getShutdownTimeoutSeconds());
        for (Actor<?> actor : running) {
            try {
                actor.join(timeout);
                logger.debug("Actor {} shut down successfully", actor.getActorId());
            } catch (TimeoutException e) {
                logger.warn("Actor {} did not stop within {}", actor.getActorId(), timeout);
            } catch (ActorException e) {
                logger.debug("Actor {} had terminated with a failure", actor.getActorId(), e);
            }
        }
        actors.clear();
        timer.shutdownNow();

        if (ownsPool) {
            pool.close();
        }
        logger.info("ParallelGroup {} shut down", name);
    }

    @Override
    public void close() {
        shutdown();
    }

    @Override
    public String toString() {
        return "ParallelGroup[" + name + ", actors=" + actors.size() + "]";
    }
}
