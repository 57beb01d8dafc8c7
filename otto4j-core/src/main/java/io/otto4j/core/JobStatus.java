package io.otto4j.core;

/**
 * Lifecycle status of a scheduled job row.
 */
public enum JobStatus {
    IDLE,
    RUNNING,
    PAUSED
}
