package io.otto4j.core;

/**
 * Result of persisting a new job.
 *
 * @param created false when a job with the same id already existed and nothing was written
 */
public record PersistResult(
        String jobId,
        boolean created
) {
    public static PersistResult createdResult(String jobId) {
        return new PersistResult(jobId, true);
    }

    public static PersistResult existingResult(String jobId) {
        return new PersistResult(jobId, false);
    }
}
