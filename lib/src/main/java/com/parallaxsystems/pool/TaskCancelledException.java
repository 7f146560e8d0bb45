package com.parallaxsystems.pool;

import java.util.concurrent.CancellationException;

/**
 * Signals that a unit of work was cancelled before it started, either explicitly or
 * because its pool was shut down without draining.
 */
public class TaskCancelledException extends CancellationException {

    /**
     * Creates a new TaskCancelledException with the specified detail message.
     *
     * @param message the detail message
     */
    public TaskCancelledException(String message) {
        super(message);
    }
}
