package io.tick4j.core;

/**
 * Failure kinds reported by the registry, the scheduler and metadata stores.
 */
public enum ErrorKind {
    CANT_ADD,
    CANT_REMOVE,
    GET_JOB_DATA,
    UPDATE_JOB_DATA,
    CANT_INIT,
    CANT_LIST_NEXT_TICKS,
    COULD_NOT_GET_TIME_UNTIL_NEXT_TICK,
    /**
     * Schedule exhausted. Used internally to retire a job, never surfaced to the host.
     */
    NO_NEXT_TICK,
    SHUTDOWN_NOTIFIER
}
