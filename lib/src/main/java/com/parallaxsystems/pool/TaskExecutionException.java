package com.parallaxsystems.pool;

/**
 * Wraps an exception thrown inside a unit of work submitted to a {@link TaskPool}
 * or inside the compute step of a fork/join task node.
 * The original exception is always available as the cause.
 */
public class TaskExecutionException extends RuntimeException {

    /**
     * Creates a new TaskExecutionException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the exception thrown by the unit of work
     */
    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates a new TaskExecutionException with the specified detail message.
     *
     * @param message the detail message
     */
    public TaskExecutionException(String message) {
        super(message);
    }
}
