package io.otto4j.core;

public enum ScheduleType {
    /**
     * Runs every {@code cadenceMinutes} measured from the previous completion.
     */
    RECURRING,
    /**
     * Runs once at {@code runAt}, then becomes terminal.
     */
    ONESHOT
}
