package com.parallaxsystems.forkjoin;

/**
 * Lifecycle of a fork/join task node.
 */
public enum NodeState {
    /** Created but not yet forked into an orchestration. */
    NEW,
    /** Forked and waiting for a worker. */
    PENDING,
    /** compute() is executing. */
    RUNNING,
    /** Completed with a result. */
    DONE,
    /** compute() threw, or completed without a result. */
    FAILED,
    /** Cancelled before it started. */
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
