package com.parallaxsystems.forkjoin;

import com.parallaxsystems.pool.TaskCancelledException;
import com.parallaxsystems.pool.TaskExecutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A node of a recursive fork/join computation.
 * <p>
 * Subclasses implement {@link #compute()}, which runs on a pool worker. It may split the
 * work by calling {@link #forkOffChild(RecursiveWorker)} any number of times, read the
 * children's results through {@link #getChildrenResults()}, and must finish by calling
 * {@link #setResult(Object)}:
 * <pre>{@code
 * class CountLeaves extends RecursiveWorker<Long> {
 *     protected void compute() {
 *         if (depth == 0) {
 *             setResult(1L);
 *             return;
 *         }
 *         for (int i = 0; i < branching; i++) {
 *             forkOffChild(new CountLeaves(depth - 1, branching));
 *         }
 *         setResult(getChildrenResults().stream().mapToLong(Long::longValue).sum());
 *     }
 * }
 * }</pre>
 * A node can be forked only once, which keeps the computation a tree.
 *
 * @param <T> the result type, shared by a node and its children
 */
public abstract class RecursiveWorker<T> {

    private final AtomicReference<NodeState> state = new AtomicReference<>(NodeState.NEW);
    private final List<Integer> childIndices = new ArrayList<>();

    private TaskArena arena;
    private int index = -1;
    private int parentIndex = -1;
    private NodeTask task;
    private volatile Thread runner;

    private T result;
    private boolean resultSet;
    private RuntimeException failure;

    /**
     * Performs this node's share of the work. Must call {@link #setResult(Object)} before
     * returning normally.
     */
    protected abstract void compute();

    /**
     * Forks a child node for independent execution, possibly on another worker.
     *
     * @param child a node that has not been forked before
     * @throws IllegalStateException if called outside this node's compute(), or if the
     *                               child was already forked
     */
    protected final void forkOffChild(RecursiveWorker<T> child) {
        checkInCompute("forkOffChild");
        if (child == null) {
            throw new NullPointerException("child");
        }
        if (child == this || !child.state.compareAndSet(NodeState.NEW, NodeState.PENDING)) {
            throw new IllegalStateException("Task node " + child + " has already been forked");
        }
        int childIndex = child.attach(arena, index);
        childIndices.add(childIndex);
        if (arena.isCancelled()) {
            child.cancelIfPending();
            return;
        }
        child.task.fork();
    }

    /**
     * Waits for every child forked so far and returns their results in fork order.
     * While waiting the worker helps run queued nodes, so deep trees do not exhaust the pool.
     *
     * @return the children's results
     * @throws TaskExecutionException if a child failed; remaining unstarted children are cancelled
     * @throws TaskCancelledException if a child was cancelled
     */
    protected final List<T> getChildrenResults() {
        checkInCompute("getChildrenResults");
        List<T> results = new ArrayList<>(childIndices.size());
        for (int i = 0; i < childIndices.size(); i++) {
            RecursiveWorker<T> child = child(childIndices.get(i));
            try {
                results.add(child.awaitResult());
            } catch (RuntimeException e) {
                for (int j = i + 1; j < childIndices.size(); j++) {
                    child(childIndices.get(j)).cancelIfPending();
                }
                throw e;
            }
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * Stores this node's result. May be called more than once; the last value wins.
     *
     * @param value the result, may be null
     */
    protected final void setResult(T value) {
        checkInCompute("setResult");
        this.result = value;
        this.resultSet = true;
    }

    /**
     * Number of children forked so far.
     */
    protected final int getChildCount() {
        return childIndices.size();
    }

    public final NodeState getState() {
        return state.get();
    }

    /**
     * Position of this node in its orchestration's arena, or -1 if not yet forked.
     */
    public final int getIndex() {
        return index;
    }

    /**
     * Arena index of the parent node, or -1 for the root.
     */
    public final int getParentIndex() {
        return parentIndex;
    }

    // ---- orchestration internals ----

    final int attach(TaskArena owner, int parent) {
        this.arena = owner;
        this.parentIndex = parent;
        this.task = new NodeTask();
        this.index = owner.register(this);
        return index;
    }

    final NodeTask task() {
        return task;
    }

    final boolean markPending() {
        return state.compareAndSet(NodeState.NEW, NodeState.PENDING);
    }

    final boolean cancelIfPending() {
        if (state.compareAndSet(NodeState.PENDING, NodeState.CANCELLED)) {
            failure = new TaskCancelledException("Task node " + index + " was cancelled");
            if (task != null) {
                task.cancel(false);
            }
            return true;
        }
        return false;
    }

    /**
     * Waits for this node to finish and returns its result or throws its failure.
     */
    final T awaitResult() {
        try {
            task.join();
        } catch (CancellationException e) {
            // the node was cancelled before it ran; its state says so
        }
        switch (state.get()) {
            case DONE:
                return result;
            case FAILED:
                throw failure;
            case CANCELLED:
                throw failure != null ? failure : new TaskCancelledException("Task node " + index + " was cancelled");
            default:
                throw new IllegalStateException("Task node " + index + " joined in state " + state.get());
        }
    }

    private void execute() {
        if (!state.compareAndSet(NodeState.PENDING, NodeState.RUNNING)) {
            return;
        }
        runner = Thread.currentThread();
        try {
            compute();
            if (!resultSet) {
                throw new IllegalStateException("compute() returned without calling setResult()");
            }
            state.set(NodeState.DONE);
        } catch (TaskExecutionException | TaskCancelledException e) {
            failure = e;
            state.set(e instanceof TaskCancelledException ? NodeState.CANCELLED : NodeState.FAILED);
        } catch (RuntimeException | Error e) {
            failure = new TaskExecutionException("Task node " + index + " failed: " + e, e);
            state.set(NodeState.FAILED);
        } finally {
            runner = null;
        }
    }

    @SuppressWarnings("unchecked")
    private RecursiveWorker<T> child(int childIndex) {
        return (RecursiveWorker<T>) arena.node(childIndex);
    }

    private void checkInCompute(String operation) {
        if (runner != Thread.currentThread()) {
            throw new IllegalStateException(operation + "() may only be called from within compute()");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[index=" + index + ", state=" + state.get() + "]";
    }

    /**
     * Adapter running the node on the pool. Never completes exceptionally itself; the
     * outcome is recorded on the node.
     */
    final class NodeTask extends RecursiveAction {
        @Override
        protected void compute() {
            execute();
        }
    }
}
