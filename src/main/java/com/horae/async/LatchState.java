package com.horae.async;

/**
 * Lifecycle states of a {@link Latch}.
 * 
 * The normal cycle is STOPPED → STARTING → RUNNING → STOPPING → STOPPED.
 */
public enum LatchState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
