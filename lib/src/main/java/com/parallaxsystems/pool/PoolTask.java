package com.parallaxsystems.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * A unit of work queued on a {@link TaskPool}. Runs its callable at most once and
 * records the outcome in a future; a task still queued can be cancelled.
 */
final class PoolTask<T> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(PoolTask.class);

    private static final int NEW = 0;
    private static final int RUNNING = 1;
    private static final int DONE = 2;
    private static final int CANCELLED = 3;

    private final Callable<T> work;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final AtomicInteger state = new AtomicInteger(NEW);
    private final Consumer<PoolTask<?>> onDequeue;
    private final TaskHandle<T> handle;

    PoolTask(Callable<T> work, Consumer<PoolTask<?>> onDequeue) {
        this.work = work;
        this.onDequeue = onDequeue;
        this.handle = new TaskHandle<>(future, this::cancel);
    }

    TaskHandle<T> handle() {
        return handle;
    }

    @Override
    public void run() {
        if (!state.compareAndSet(NEW, RUNNING)) {
            return;
        }
        onDequeue.accept(this);
        try {
            future.complete(work.call());
        } catch (Throwable e) {
            logger.debug("Task {} failed", work, e);
            future.completeExceptionally(new TaskExecutionException("Task failed: " + e, e));
        } finally {
            state.set(DONE);
        }
    }

    boolean cancel() {
        if (!state.compareAndSet(NEW, CANCELLED)) {
            return false;
        }
        onDequeue.accept(this);
        future.completeExceptionally(new TaskCancelledException("Task cancelled before it started"));
        return true;
    }
}
