package io.otto4j.internal.mongo;

import io.otto4j.core.FailedRun;
import io.otto4j.core.Job;
import io.otto4j.core.JobRun;
import io.otto4j.core.JobStatus;
import io.otto4j.core.PersistResult;
import io.otto4j.core.RunStatus;
import io.otto4j.core.RunSummary;
import io.otto4j.core.TerminalState;
import io.otto4j.spi.JobStore;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * MongoDB persistence layer for jobs and job runs.
 *
 * <p>Every lock-guarded write matches on {@code lockToken}, so a worker whose lease was taken over
 * cannot write back stale state.
 */
public class MongoJobStore implements JobStore {

    static final String UNKNOWN_JOB_TYPE = "unknown";

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public PersistResult create(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            mongoTemplate.insert(toDocument(job));
            return PersistResult.createdResult(job.id());
        } catch (DuplicateKeyException e) {
            return PersistResult.existingResult(job.id());
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, JobDocument.class)).map(MongoJobStore::toJob);
    }

    @Override
    public List<Job> listJobs() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt")));
        return mongoTemplate.find(q, JobDocument.class).stream().map(MongoJobStore::toJob).collect(Collectors.toList());
    }

    /**
     * Atomically claims (locks) at most {@code limit} due jobs.
     *
     * <p>A job is considered due when:
     * <ul>
     *   <li>{@code nextRunAt <= now}, it is not paused and has no terminal state</li>
     *   <li>and it is not locked, or its lease has expired: {@code lockToken == null || lockExpiresAt <= now}</li>
     * </ul>
     *
     * <p>Each claim is a single {@code findAndModify}, so concurrent ticks never claim the same job.
     */
    @Override
    public List<Job> claimDue(Instant now, int limit, String lockToken, Duration lease, Instant observedAt) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lease, "lease must not be null");
        Objects.requireNonNull(observedAt, "observedAt must not be null");
        if (limit <= 0) {
            return List.of();
        }
        if (lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be a positive duration");
        }
        if (lockToken == null || lockToken.isBlank()) {
            throw new IllegalArgumentException("lockToken must not be blank");
        }

        Query dueQuery = new Query(
                Criteria.where("nextRunAt").ne(null).lte(now)
                        .and("status").ne(JobStatus.PAUSED)
                        .and("terminalState").is(null)
                        .andOperator(
                                new Criteria().orOperator(
                                        Criteria.where("lockToken").is(null),
                                        Criteria.where("lockExpiresAt").lte(now)
                                )
                        )
        );
        dueQuery.with(Sort.by(Sort.Order.asc("nextRunAt")));

        Update lockUpdate = new Update()
                .set("status", JobStatus.RUNNING)
                .set("lockToken", lockToken)
                .set("lockExpiresAt", observedAt.plus(lease))
                .set("updatedAt", observedAt);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<Job> claimed = new ArrayList<>(Math.min(limit, 64));
        for (int i = 0; i < limit; i++) {
            JobDocument doc = mongoTemplate.findAndModify(dueQuery, lockUpdate, options, JobDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(toJob(doc));
        }
        return claimed;
    }

    @Override
    public boolean rescheduleRecurring(String jobId, String lockToken, Instant lastRunAt, Instant nextRunAt, Instant updatedAt) {
        Objects.requireNonNull(nextRunAt, "nextRunAt must not be null");
        if (lockToken == null) {
            return false;
        }

        Update u = unlock(updatedAt)
                .set("lastRunAt", lastRunAt)
                .set("nextRunAt", nextRunAt)
                .unset("terminalState")
                .unset("terminalReason");

        return mongoTemplate.updateFirst(lockedBy(jobId, lockToken), u, JobDocument.class).getMatchedCount() > 0;
    }

    @Override
    public boolean finalizeOneShot(String jobId, String lockToken, TerminalState terminalState,
                                   String terminalReason, Instant lastRunAt, Instant updatedAt) {
        Objects.requireNonNull(terminalState, "terminalState must not be null");
        if (lockToken == null) {
            return false;
        }

        Query q = lockedBy(jobId, lockToken);
        q.addCriteria(Criteria.where("terminalState").is(null));

        Update u = unlock(updatedAt)
                .set("lastRunAt", lastRunAt)
                .set("nextRunAt", null)
                .set("terminalState", terminalState)
                .set("terminalReason", terminalReason);

        return mongoTemplate.updateFirst(q, u, JobDocument.class).getMatchedCount() > 0;
    }

    @Override
    public boolean releaseLock(String jobId, String lockToken, Instant updatedAt) {
        if (lockToken == null) {
            return false;
        }
        return mongoTemplate.updateFirst(lockedBy(jobId, lockToken), unlock(updatedAt), JobDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean cancel(String jobId, String reason, Instant updatedAt) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("_id").is(jobId).and("terminalState").is(null));
        Update u = unlock(updatedAt)
                .set("nextRunAt", null)
                .set("terminalState", TerminalState.CANCELLED)
                .set("terminalReason", reason);
        return mongoTemplate.updateFirst(q, u, JobDocument.class).getMatchedCount() > 0;
    }

    @Override
    public boolean setPaused(String jobId, boolean paused, Instant updatedAt) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("_id").is(jobId)
                .and("terminalState").is(null)
                .and("status").is(paused ? JobStatus.IDLE : JobStatus.PAUSED));
        Update u = new Update()
                .set("status", paused ? JobStatus.PAUSED : JobStatus.IDLE)
                .set("updatedAt", updatedAt);
        return mongoTemplate.updateFirst(q, u, JobDocument.class).getMatchedCount() > 0;
    }

    @Override
    public void insertRun(JobRun run) {
        Objects.requireNonNull(run, "run must not be null");
        mongoTemplate.insert(toDocument(run));
    }

    @Override
    public boolean markRunFinished(String runId, RunStatus status, Instant finishedAt,
                                   String errorCode, String errorMessage, String resultJson) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");

        Query q = new Query(Criteria.where("_id").is(runId).and("finishedAt").is(null));
        Update u = new Update()
                .set("status", status)
                .set("finishedAt", finishedAt)
                .set("errorCode", errorCode)
                .set("errorMessage", errorMessage)
                .set("resultJson", resultJson);
        return mongoTemplate.updateFirst(q, u, JobRunDocument.class).getMatchedCount() > 0;
    }

    @Override
    public List<JobRun> listRunsByJobId(String jobId, int limit) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.desc("startedAt")))
                .limit(limit);
        return mongoTemplate.find(q, JobRunDocument.class).stream().map(MongoJobStore::toRun).collect(Collectors.toList());
    }

    /**
     * Failed, finished runs started at or after {@code since}, newest first, joined with their job's type.
     * Runs whose job no longer exists report type {@value #UNKNOWN_JOB_TYPE}.
     */
    @Override
    public List<FailedRun> listRecentFailedRuns(Instant since, int limit) {
        Objects.requireNonNull(since, "since must not be null");
        Query q = new Query(Criteria.where("status").is(RunStatus.FAILED)
                .and("finishedAt").ne(null)
                .and("startedAt").gte(since))
                .with(Sort.by(Sort.Order.desc("startedAt")))
                .limit(limit);
        List<JobRunDocument> runs = mongoTemplate.find(q, JobRunDocument.class);
        if (runs.isEmpty()) {
            return List.of();
        }

        Map<String, String> typesById = jobTypesOf(runs);
        List<FailedRun> failed = new ArrayList<>(runs.size());
        for (JobRunDocument run : runs) {
            failed.add(new FailedRun(
                    run.getId(),
                    run.getJobId(),
                    typesById.getOrDefault(run.getJobId(), UNKNOWN_JOB_TYPE),
                    run.getStartedAt(),
                    run.getFinishedAt(),
                    run.getErrorCode(),
                    run.getErrorMessage()
            ));
        }
        return failed;
    }

    @Override
    public List<RunSummary> listRecentRuns(Instant since, int limit) {
        Objects.requireNonNull(since, "since must not be null");
        Query q = new Query(Criteria.where("startedAt").gte(since))
                .with(Sort.by(Sort.Order.desc("startedAt")))
                .limit(limit);
        List<JobRunDocument> runs = mongoTemplate.find(q, JobRunDocument.class);
        if (runs.isEmpty()) {
            return List.of();
        }

        Map<String, String> typesById = jobTypesOf(runs);
        List<RunSummary> summaries = new ArrayList<>(runs.size());
        for (JobRunDocument run : runs) {
            summaries.add(new RunSummary(
                    run.getId(),
                    run.getJobId(),
                    typesById.getOrDefault(run.getJobId(), UNKNOWN_JOB_TYPE),
                    run.getStartedAt(),
                    run.getFinishedAt(),
                    run.getStatus(),
                    run.getErrorCode(),
                    run.getErrorMessage()
            ));
        }
        return summaries;
    }

    private Map<String, String> jobTypesOf(List<JobRunDocument> runs) {
        Set<String> jobIds = runs.stream().map(JobRunDocument::getJobId).collect(Collectors.toSet());
        Query jobsQuery = new Query(Criteria.where("_id").in(jobIds));
        jobsQuery.fields().include("_id").include("type");
        Map<String, String> typesById = new HashMap<>();
        for (JobDocument job : mongoTemplate.find(jobsQuery, JobDocument.class)) {
            typesById.put(job.getId(), job.getType());
        }
        return typesById;
    }

    private static Query lockedBy(String jobId, String lockToken) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        // Prevent stale write-back if another tick already re-claimed this job.
        return new Query(Criteria.where("_id").is(jobId).and("lockToken").is(lockToken));
    }

    private static Update unlock(Instant updatedAt) {
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        return new Update()
                .set("status", JobStatus.IDLE)
                .unset("lockToken")
                .unset("lockExpiresAt")
                .set("updatedAt", updatedAt);
    }

    static JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.id());
        doc.setType(job.type());
        doc.setStatus(job.status());
        doc.setScheduleType(job.scheduleType());
        doc.setProfileId(job.profileId());
        doc.setRunAt(job.runAt());
        doc.setCadenceMinutes(job.cadenceMinutes());
        doc.setPayload(job.payload());
        doc.setLastRunAt(job.lastRunAt());
        doc.setNextRunAt(job.nextRunAt());
        doc.setTerminalState(job.terminalState());
        doc.setTerminalReason(job.terminalReason());
        doc.setLockToken(job.lockToken());
        doc.setLockExpiresAt(job.lockExpiresAt());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        return doc;
    }

    static Job toJob(JobDocument doc) {
        return Job.builder()
                .id(doc.getId())
                .type(doc.getType())
                .status(doc.getStatus() != null ? doc.getStatus() : JobStatus.IDLE)
                .scheduleType(doc.getScheduleType())
                .profileId(doc.getProfileId())
                .runAt(doc.getRunAt())
                .cadenceMinutes(doc.getCadenceMinutes())
                .payload(doc.getPayload())
                .lastRunAt(doc.getLastRunAt())
                .nextRunAt(doc.getNextRunAt())
                .terminalState(doc.getTerminalState())
                .terminalReason(doc.getTerminalReason())
                .lockToken(doc.getLockToken())
                .lockExpiresAt(doc.getLockExpiresAt())
                .createdAt(doc.getCreatedAt())
                .updatedAt(doc.getUpdatedAt())
                .build();
    }

    private static JobRunDocument toDocument(JobRun run) {
        JobRunDocument doc = new JobRunDocument();
        doc.setId(run.id());
        doc.setJobId(run.jobId());
        doc.setScheduledFor(run.scheduledFor());
        doc.setStartedAt(run.startedAt());
        doc.setFinishedAt(run.finishedAt());
        doc.setStatus(run.status());
        doc.setErrorCode(run.errorCode());
        doc.setErrorMessage(run.errorMessage());
        doc.setResultJson(run.resultJson());
        doc.setCreatedAt(run.createdAt());
        return doc;
    }

    private static JobRun toRun(JobRunDocument doc) {
        return new JobRun(doc.getId(), doc.getJobId(), doc.getScheduledFor(), doc.getStartedAt(), doc.getFinishedAt(),
                doc.getStatus(), doc.getErrorCode(), doc.getErrorMessage(), doc.getResultJson(), doc.getCreatedAt());
    }
}
