package com.parallaxsystems.forkjoin;

import com.parallaxsystems.pool.TaskCancelledException;
import com.parallaxsystems.pool.TaskExecutionException;

/**
 * A running fork/join computation: the root node and the arena of every node forked
 * beneath it.
 *
 * @param <T> the result type
 */
public final class Orchestration<T> {

    private final RecursiveWorker<T> root;
    private final TaskArena arena;

    Orchestration(RecursiveWorker<T> root, TaskArena arena) {
        this.root = root;
        this.arena = arena;
    }

    /**
     * Blocks until the root node finishes and returns its result.
     *
     * @throws TaskExecutionException if the root or a child whose failure reached it failed
     * @throws TaskCancelledException if the computation was cancelled before it finished
     */
    public T join() {
        return root.awaitResult();
    }

    /**
     * Cancels every node that has not started yet. Nodes already running complete, and a
     * parent waiting on a cancelled child fails with {@link TaskCancelledException}.
     *
     * @return the number of nodes cancelled
     */
    public int cancel() {
        return arena.cancelPending();
    }

    public boolean isDone() {
        return root.getState().isTerminal();
    }

    public boolean isCancelled() {
        return arena.isCancelled();
    }

    /**
     * Number of nodes forked so far, the root included.
     */
    public int taskCount() {
        return arena.size();
    }

    public NodeState getRootState() {
        return root.getState();
    }
}
