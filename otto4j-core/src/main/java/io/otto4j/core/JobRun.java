package io.otto4j.core;

import java.time.Instant;

/**
 * Audit row for one execution of a job. Inserted as a {@link RunStatus#SKIPPED} placeholder with
 * {@code finishedAt == null} and finalized exactly once.
 */
public record JobRun(
        String id,
        String jobId,
        Instant scheduledFor,
        Instant startedAt,
        Instant finishedAt,
        RunStatus status,
        String errorCode,
        String errorMessage,
        String resultJson,
        Instant createdAt
) {

    public static JobRun placeholder(String id, String jobId, Instant scheduledFor, Instant startedAt) {
        return new JobRun(id, jobId, scheduledFor, startedAt, null, RunStatus.SKIPPED,
                null, null, null, startedAt);
    }

    public boolean isFinished() {
        return finishedAt != null;
    }
}
