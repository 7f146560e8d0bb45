package com.parallaxsystems.pool;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * A fixed-size pool of worker threads that every other component of the runtime
 * schedules its work on: actor runners, fork/join task nodes and pipeline segments.
 * <p>
 * The pool is backed by a work-stealing {@link ForkJoinPool}, so workers pull available
 * work greedily from their own deque and steal from others when idle. A unit of work that
 * throws never kills its worker: the failure is logged and attached to the
 * {@link TaskHandle} returned by {@link #submit(Callable)}.
 */
public class TaskPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TaskPool.class);

    private final PoolConfig config;
    private final ForkJoinPool forkJoinPool;
    private final Set<PoolTask<?>> queued = ConcurrentHashMap.newKeySet();
    private volatile boolean shutdown = false;

    /**
     * Creates a pool with the default configuration (one worker per available processor).
     */
    public TaskPool() {
        this(new PoolConfig());
    }

    /**
     * Creates a pool with the given number of worker threads.
     *
     * @param parallelism The number of worker threads
     */
    public TaskPool(int parallelism) {
        this(PoolConfig.withParallelism(parallelism));
    }

    /**
     * Creates a pool from the given configuration.
     *
     * @param config The pool configuration
     */
    public TaskPool(PoolConfig config) {
        this.config = Preconditions.checkNotNull(config, "config");
        AtomicInteger threadNumber = new AtomicInteger(1);
        String prefix = config.getName() + "-worker-";
        ForkJoinPool.ForkJoinWorkerThreadFactory threadFactory = pool -> {
            ForkJoinWorkerThread thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            thread.setName(prefix + threadNumber.getAndIncrement());
            thread.setDaemon(config.isDaemon());
            return thread;
        };
        this.forkJoinPool = new ForkJoinPool(
                config.getParallelism(),
                threadFactory,
                (thread, error) -> logger.error("Uncaught error on pool worker {}", thread.getName(), error),
                config.isAsyncMode());
        logger.debug("Created task pool {}", config);
    }

    /**
     * Submits a unit of work returning a value.
     *
     * @param work The work to run on a pool worker
     * @param <T> The result type
     * @return A handle to the eventual result
     * @throws RejectedExecutionException if the pool has been shut down
     */
    public <T> TaskHandle<T> submit(Callable<T> work) {
        Preconditions.checkNotNull(work, "work");
        ensureRunning();
        PoolTask<T> task = new PoolTask<>(work, queued::remove);
        queued.add(task);
        try {
            forkJoinPool.execute(task);
        } catch (RejectedExecutionException e) {
            queued.remove(task);
            throw e;
        }
        return task.handle();
    }

    /**
     * Submits a unit of work producing no value.
     *
     * @param work The work to run on a pool worker
     * @return A handle that completes with null once the work has run
     */
    public TaskHandle<Void> submit(Runnable work) {
        Preconditions.checkNotNull(work, "work");
        return submit(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Wraps a function so that every call runs asynchronously on this pool.
     * The returned function hands back a {@link TaskHandle} immediately.
     *
     * @param function The function to run asynchronously
     * @param <A> The argument type
     * @param <R> The result type
     * @return An asynchronous version of the function
     */
    public <A, R> Function<A, TaskHandle<R>> async(Function<? super A, ? extends R> function) {
        Preconditions.checkNotNull(function, "function");
        return argument -> submit(() -> function.apply(argument));
    }

    /**
     * Schedules an internal fire-and-forget task, such as an actor runner.
     * Exceptions escaping the task are logged and never propagate to the worker.
     *
     * @param task The task to run
     * @throws RejectedExecutionException if the pool has been shut down
     */
    public void execute(Runnable task) {
        ensureRunning();
        forkJoinPool.execute(() -> {
            try {
                task.run();
            } catch (Throwable e) {
                logger.error("Unhandled error in pool {} task", config.getName(), e);
            }
        });
    }

    /**
     * Schedules a fork/join task on this pool. Used by the fork/join executor and the
     * collection pipeline, whose tasks fork their children onto the same workers.
     *
     * @param task The fork/join task
     * @throws RejectedExecutionException if the pool has been shut down
     */
    public void schedule(ForkJoinTask<?> task) {
        ensureRunning();
        forkJoinPool.execute(task);
    }

    /**
     * Returns whether the calling thread is one of this pool's workers.
     *
     * @return true on a worker thread of this pool
     */
    public boolean isWorkerThread() {
        Thread current = Thread.currentThread();
        return current instanceof ForkJoinWorkerThread
                && ((ForkJoinWorkerThread) current).getPool() == forkJoinPool;
    }

    /**
     * Initiates shutdown. No new work is accepted afterwards.
     *
     * @param drain true to let queued work run to completion, false to discard queued work;
     *              handles of discarded work complete with {@link TaskCancelledException}
     */
    public void shutdown(boolean drain) {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.debug("Shutting down task pool {} (drain={})", config.getName(), drain);
        if (drain) {
            forkJoinPool.shutdown();
        } else {
            List<PoolTask<?>> discarded = new ArrayList<>(queued);
            int cancelled = 0;
            for (PoolTask<?> task : discarded) {
                if (task.cancel()) {
                    cancelled++;
                }
            }
            if (cancelled > 0) {
                logger.debug("Task pool {} discarded {} queued tasks", config.getName(), cancelled);
            }
            forkJoinPool.shutdownNow();
        }
    }

    /**
     * Waits for all workers to finish after a shutdown.
     *
     * @param timeout The maximum time to wait
     * @return true if the pool terminated, false if the timeout elapsed
     */
    public boolean awaitTermination(Duration timeout) {
        try {
            return forkJoinPool.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for task pool {} termination", config.getName());
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Drains and shuts down the pool, waiting up to the configured shutdown timeout.
     * Work still running after the timeout is abandoned.
     */
    @Override
    public void close() {
        shutdown(true);
        if (!awaitTermination(Duration.ofSeconds(config.getShutdownTimeoutSeconds()))) {
            logger.warn("Task pool {} did not terminate within {}s, forcing shutdown",
                    config.getName(), config.getShutdownTimeoutSeconds());
            forkJoinPool.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public boolean isTerminated() {
        return forkJoinPool.isTerminated();
    }

    public int getParallelism() {
        return config.getParallelism();
    }

    public PoolConfig getConfig() {
        return config;
    }

    /**
     * Approximate number of submitted units of work that have not started yet.
     */
    public int getQueuedTaskCount() {
        return queued.size();
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new RejectedExecutionException("Task pool " + config.getName() + " has been shut down");
        }
    }

    @Override
    public String toString() {
        return "TaskPool[" + config.getName() + ", parallelism=" + config.getParallelism() + "]";
    }
}
