package io.otto4j.core;

import java.time.Instant;

/**
 * A {@link JobRun} of any status joined with the type of its job. {@code finishedAt} is null while
 * the run is still in flight.
 */
public record RunSummary(
        String runId,
        String jobId,
        String jobType,
        Instant startedAt,
        Instant finishedAt,
        RunStatus status,
        String errorCode,
        String errorMessage
) {
}
