package io.otto4j.support;

import io.otto4j.core.FailedRun;
import io.otto4j.core.Job;
import io.otto4j.core.JobRun;
import io.otto4j.core.JobStatus;
import io.otto4j.core.PersistResult;
import io.otto4j.core.RunStatus;
import io.otto4j.core.RunSummary;
import io.otto4j.core.TerminalState;
import io.otto4j.spi.JobStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link JobStore} test double with the same claim and lock-token semantics as the Mongo store.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, JobRun> runs = new LinkedHashMap<>();

    @Override
    public synchronized PersistResult create(Job job) {
        if (jobs.containsKey(job.id())) {
            return PersistResult.existingResult(job.id());
        }
        jobs.put(job.id(), job);
        return PersistResult.createdResult(job.id());
    }

    @Override
    public synchronized Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<Job> listJobs() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public synchronized List<Job> claimDue(Instant now, int limit, String lockToken, Duration lease, Instant observedAt) {
        List<Job> due = jobs.values().stream()
                .filter(job -> job.terminalState() == null)
                .filter(job -> job.status() != JobStatus.PAUSED)
                .filter(job -> job.nextRunAt() != null && !job.nextRunAt().isAfter(now))
                .filter(job -> job.lockToken() == null || job.lockExpiresAt() == null || !job.lockExpiresAt().isAfter(now))
                .sorted(Comparator.comparing(Job::nextRunAt))
                .limit(limit)
                .collect(Collectors.toList());

        List<Job> claimed = new ArrayList<>(due.size());
        for (Job job : due) {
            Job locked = job.toBuilder()
                    .status(JobStatus.RUNNING)
                    .lockToken(lockToken)
                    .lockExpiresAt(observedAt.plus(lease))
                    .updatedAt(observedAt)
                    .build();
            jobs.put(job.id(), locked);
            claimed.add(locked);
        }
        return claimed;
    }

    @Override
    public synchronized boolean rescheduleRecurring(String jobId, String lockToken, Instant lastRunAt, Instant nextRunAt, Instant updatedAt) {
        Job job = lockedBy(jobId, lockToken);
        if (job == null) {
            return false;
        }
        jobs.put(jobId, unlocked(job, updatedAt).lastRunAt(lastRunAt).nextRunAt(nextRunAt)
                .terminalState(null).terminalReason(null).build());
        return true;
    }

    @Override
    public synchronized boolean finalizeOneShot(String jobId, String lockToken, TerminalState terminalState,
                                                String terminalReason, Instant lastRunAt, Instant updatedAt) {
        Job job = lockedBy(jobId, lockToken);
        if (job == null || job.terminalState() != null) {
            return false;
        }
        jobs.put(jobId, unlocked(job, updatedAt).lastRunAt(lastRunAt).nextRunAt(null)
                .terminalState(terminalState).terminalReason(terminalReason).build());
        return true;
    }

    @Override
    public synchronized boolean releaseLock(String jobId, String lockToken, Instant updatedAt) {
        Job job = lockedBy(jobId, lockToken);
        if (job == null) {
            return false;
        }
        jobs.put(jobId, unlocked(job, updatedAt).build());
        return true;
    }

    @Override
    public synchronized boolean cancel(String jobId, String reason, Instant updatedAt) {
        Job job = jobs.get(jobId);
        if (job == null || job.terminalState() != null) {
            return false;
        }
        jobs.put(jobId, unlocked(job, updatedAt).nextRunAt(null)
                .terminalState(TerminalState.CANCELLED).terminalReason(reason).build());
        return true;
    }

    @Override
    public synchronized boolean setPaused(String jobId, boolean paused, Instant updatedAt) {
        Job job = jobs.get(jobId);
        if (job == null || job.terminalState() != null) {
            return false;
        }
        JobStatus expected = paused ? JobStatus.IDLE : JobStatus.PAUSED;
        if (job.status() != expected) {
            return false;
        }
        jobs.put(jobId, job.toBuilder().status(paused ? JobStatus.PAUSED : JobStatus.IDLE).updatedAt(updatedAt).build());
        return true;
    }

    @Override
    public synchronized void insertRun(JobRun run) {
        runs.put(run.id(), run);
    }

    @Override
    public synchronized boolean markRunFinished(String runId, RunStatus status, Instant finishedAt,
                                                String errorCode, String errorMessage, String resultJson) {
        JobRun run = runs.get(runId);
        if (run == null || run.finishedAt() != null) {
            return false;
        }
        runs.put(runId, new JobRun(run.id(), run.jobId(), run.scheduledFor(), run.startedAt(), finishedAt, status,
                errorCode, errorMessage, resultJson, run.createdAt()));
        return true;
    }

    @Override
    public synchronized List<JobRun> listRunsByJobId(String jobId, int limit) {
        return runs.values().stream()
                .filter(run -> run.jobId().equals(jobId))
                .sorted(Comparator.comparing(JobRun::startedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<FailedRun> listRecentFailedRuns(Instant since, int limit) {
        return runs.values().stream()
                .filter(run -> run.status() == RunStatus.FAILED && run.finishedAt() != null)
                .filter(run -> !run.startedAt().isBefore(since))
                .sorted(Comparator.comparing(JobRun::startedAt).reversed())
                .limit(limit)
                .map(run -> new FailedRun(run.id(), run.jobId(),
                        jobs.containsKey(run.jobId()) ? jobs.get(run.jobId()).type() : "unknown",
                        run.startedAt(), run.finishedAt(), run.errorCode(), run.errorMessage()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<RunSummary> listRecentRuns(Instant since, int limit) {
        return runs.values().stream()
                .filter(run -> !run.startedAt().isBefore(since))
                .sorted(Comparator.comparing(JobRun::startedAt).reversed())
                .limit(limit)
                .map(run -> new RunSummary(run.id(), run.jobId(),
                        jobs.containsKey(run.jobId()) ? jobs.get(run.jobId()).type() : "unknown",
                        run.startedAt(), run.finishedAt(), run.status(), run.errorCode(), run.errorMessage()))
                .collect(Collectors.toList());
    }

    public synchronized Job get(String jobId) {
        return jobs.get(jobId);
    }

    public synchronized List<JobRun> allRuns() {
        return new ArrayList<>(runs.values());
    }

    private Job lockedBy(String jobId, String lockToken) {
        Job job = jobs.get(jobId);
        if (job == null || lockToken == null || !lockToken.equals(job.lockToken())) {
            return null;
        }
        return job;
    }

    private static Job.Builder unlocked(Job job, Instant updatedAt) {
        return job.toBuilder()
                .status(job.status() == JobStatus.PAUSED ? JobStatus.PAUSED : JobStatus.IDLE)
                .lockToken(null)
                .lockExpiresAt(null)
                .updatedAt(updatedAt);
    }
}
