package io.otto4j.kernel;

import java.time.Duration;
import java.util.Objects;

/**
 * Scheduler kernel tuning.
 *
 * @param tickInterval  time between claim ticks, at least one second
 * @param batchSize     maximum jobs claimed per tick
 * @param lockLease     lease granted to a claim; never shorter than the tick interval
 * @param workerThreads size of the pool that executes claimed jobs
 */
public record SchedulerSettings(
        boolean enabled,
        Duration tickInterval,
        int batchSize,
        Duration lockLease,
        int workerThreads
) {
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_BATCH_SIZE = 20;
    public static final Duration DEFAULT_LOCK_LEASE = Duration.ofSeconds(90);

    public SchedulerSettings {
        Objects.requireNonNull(tickInterval, "tickInterval must not be null");
        Objects.requireNonNull(lockLease, "lockLease must not be null");
        if (tickInterval.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("tickInterval must be at least 1s");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (lockLease.compareTo(tickInterval) < 0) {
            throw new IllegalArgumentException("lockLease must not be shorter than tickInterval");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(true, DEFAULT_TICK_INTERVAL, DEFAULT_BATCH_SIZE, DEFAULT_LOCK_LEASE, 1);
    }
}
