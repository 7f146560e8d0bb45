package com.parallaxsystems.forkjoin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns every node of one orchestration. Nodes refer to their children by arena index,
 * and children hold only their parent's index, so the tree has no back-pointers and a
 * cancellation sweep can visit every node without walking it.
 */
final class TaskArena {

    private static final Logger logger = LoggerFactory.getLogger(TaskArena.class);

    private final List<RecursiveWorker<?>> nodes = new ArrayList<>();
    private volatile boolean cancelled = false;

    synchronized int register(RecursiveWorker<?> node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    synchronized RecursiveWorker<?> node(int index) {
        return nodes.get(index);
    }

    synchronized int size() {
        return nodes.size();
    }

    boolean isCancelled() {
        return cancelled;
    }

    /**
     * Marks the arena cancelled and cancels every node that has not started yet.
     * Running nodes are left to complete.
     *
     * @return the number of nodes cancelled by this sweep
     */
    int cancelPending() {
        cancelled = true;
        List<RecursiveWorker<?>> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(nodes);
        }
        int count = 0;
        for (RecursiveWorker<?> node : snapshot) {
            if (node.cancelIfPending()) {
                count++;
            }
        }
        logger.debug("Cancellation sweep cancelled {} of {} task nodes", count, snapshot.size());
        return count;
    }
}
