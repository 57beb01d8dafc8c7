package io.otto4j.core;

import java.time.Instant;

/**
 * A failed {@link JobRun} joined with the type of its job.
 */
public record FailedRun(
        String runId,
        String jobId,
        String jobType,
        Instant startedAt,
        Instant finishedAt,
        String errorCode,
        String errorMessage
) {
}
