package com.parallaxsystems.forkjoin;

import com.google.common.base.Preconditions;
import com.parallaxsystems.pool.TaskPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs recursive {@link RecursiveWorker} computations on a {@link TaskPool}.
 * <p>
 * Each orchestration gets its own arena of nodes. Nodes forked from a worker go onto that
 * worker's deque and are stolen by idle workers; a node waiting for its children helps
 * execute queued nodes instead of parking, so trees deeper than the pool is wide still
 * complete.
 */
public class ForkJoinExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ForkJoinExecutor.class);

    private final TaskPool pool;

    public ForkJoinExecutor(TaskPool pool) {
        this.pool = Preconditions.checkNotNull(pool, "pool");
    }

    /**
     * Starts a computation and returns a handle to it.
     *
     * @param root a node that has not been forked before
     * @throws IllegalStateException if the root was already forked
     */
    public <T> Orchestration<T> submit(RecursiveWorker<T> root) {
        Preconditions.checkNotNull(root, "root");
        if (!root.markPending()) {
            throw new IllegalStateException("Task node " + root + " has already been forked");
        }
        TaskArena arena = new TaskArena();
        root.attach(arena, -1);
        if (pool.isWorkerThread()) {
            // nested orchestration, e.g. a pipeline inside an actor: stay on this worker's deque
            root.task().fork();
        } else {
            pool.schedule(root.task());
        }
        logger.trace("Submitted fork/join root {}", root);
        return new Orchestration<>(root, arena);
    }

    /**
     * Runs a computation to completion and returns the root's result.
     *
     * @throws com.parallaxsystems.pool.TaskExecutionException if a node failed
     */
    public <T> T orchestrate(RecursiveWorker<T> root) {
        return submit(root).join();
    }

    public TaskPool getPool() {
        return pool;
    }
}
