package com.parallaxsystems.dataflow;

/**
 * Thrown when a dataflow read cannot complete, for example because the reading thread
 * was interrupted.
 */
public class DataflowException extends RuntimeException {

    public DataflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
