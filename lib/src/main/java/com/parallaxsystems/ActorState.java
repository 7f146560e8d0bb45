package com.parallaxsystems;

/**
 * Lifecycle states of an actor. Transitions only move forward:
 * NEW, ACTIVE, TERMINATING, STOPPED. A NEW actor that is stopped goes straight to STOPPED.
 */
public enum ActorState {
    NEW,
    ACTIVE,
    TERMINATING,
    STOPPED
}
