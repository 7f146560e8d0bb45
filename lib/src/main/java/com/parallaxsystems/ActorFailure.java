package com.parallaxsystems;

/**
 * Notification sent to a supervisor when an actor terminates because a handler threw.
 *
 * @param actorId the failed actor
 * @param message the message being processed, or null if the failure happened outside
 *                message processing (for example in a start hook)
 * @param cause   the exception that escaped the handler
 */
public record ActorFailure(String actorId, Object message, Throwable cause) {
}
