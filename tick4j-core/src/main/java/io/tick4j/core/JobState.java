package io.tick4j.core;

/**
 * Lifecycle events a listener can subscribe to.
 */
public enum JobState {
    SCHEDULED,
    STARTED,
    DONE,
    STOPPED,
    REMOVED
}
