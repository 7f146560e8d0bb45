package com.parallaxsystems;

/**
 * Unchecked exception thrown when a {@link Reply} completes with a failure.
 */
public class ReplyException extends RuntimeException {

    public ReplyException(String message) {
        super(message);
    }

    public ReplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
