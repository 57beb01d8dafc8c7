package io.otto4j.spi;

import io.otto4j.core.FailedRun;
import io.otto4j.core.Job;
import io.otto4j.core.JobRun;
import io.otto4j.core.PersistResult;
import io.otto4j.core.RunStatus;
import io.otto4j.core.RunSummary;
import io.otto4j.core.TerminalState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for jobs and their run audit rows.
 *
 * <p>Every mutating operation must be atomic at the storage layer. Writes that take a
 * {@code lockToken} only apply while that token is still the job's current lock; they return
 * {@code false} when another writer has taken over.
 */
public interface JobStore {

    PersistResult create(Job job);

    Optional<Job> findById(String jobId);

    List<Job> listJobs();

    /**
     * Atomically claims up to {@code limit} due jobs.
     *
     * <p>A job is due when {@code nextRunAt <= now}, it is not paused or terminal, and it does not
     * hold a live lease ({@code lockToken == null || lockExpiresAt <= now}). Claimed jobs become
     * {@code RUNNING} with the given token and {@code lockExpiresAt = observedAt + lease}.
     * Two concurrent callers never claim the same job.
     *
     * @return the claimed rows, earliest {@code nextRunAt} first
     */
    List<Job> claimDue(Instant now, int limit, String lockToken, Duration lease, Instant observedAt);

    boolean rescheduleRecurring(String jobId, String lockToken, Instant lastRunAt, Instant nextRunAt, Instant updatedAt);

    boolean finalizeOneShot(String jobId,
                            String lockToken,
                            TerminalState terminalState,
                            String terminalReason,
                            Instant lastRunAt,
                            Instant updatedAt);

    /**
     * Clears the lock without a schedule transition. {@code nextRunAt} is left unchanged so the job is
     * picked up again on the next tick.
     */
    boolean releaseLock(String jobId, String lockToken, Instant updatedAt);

    /**
     * Marks a non-terminal job {@code CANCELLED}, clearing its schedule and any lock.
     */
    boolean cancel(String jobId, String reason, Instant updatedAt);

    /**
     * Pauses an idle job or resumes a paused one. Running jobs are not affected.
     */
    boolean setPaused(String jobId, boolean paused, Instant updatedAt);

    void insertRun(JobRun run);

    /**
     * Finalizes a placeholder run. A run that already has {@code finishedAt} is left untouched.
     */
    boolean markRunFinished(String runId,
                            RunStatus status,
                            Instant finishedAt,
                            String errorCode,
                            String errorMessage,
                            String resultJson);

    /**
     * @return runs of the job, newest {@code startedAt} first
     */
    List<JobRun> listRunsByJobId(String jobId, int limit);

    /**
     * @return failed runs started at or after {@code since}, newest first
     */
    List<FailedRun> listRecentFailedRuns(Instant since, int limit);

    /**
     * @return runs of every status started at or after {@code since}, newest first
     */
    List<RunSummary> listRecentRuns(Instant since, int limit);
}
