package io.otto4j.config;

import io.otto4j.internal.mongo.JobDocument;
import io.otto4j.internal.mongo.JobRunDocument;
import io.otto4j.internal.mongo.OutboundMessageDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

import java.util.Objects;

/**
 * MongoDB index definitions for otto4j.
 *
 * <p><b>Important:</b> Indexes are <b>NOT</b> created at application startup unless
 * {@code otto.ensure-indexes-on-startup=true}. In production, indexes are usually managed by DB
 * migrations / ops scripts. The one exception is {@code ux_messages_out_dedupe_key}: outbound dedupe
 * depends on it, so {@link io.otto4j.internal.mongo.MongoOutboundMessageStore} creates it before its
 * first insert.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_jobs_due_claim</b> on {@code jobs}: { status: 1, nextRunAt: 1, lockExpiresAt: 1 }
 *       <br/>Used by claiming due jobs with lease filtering.</li>
 *   <li><b>idx_job_runs_job_started</b> on {@code job_runs}: { jobId: 1, startedAt: -1 }
 *       <br/>Run history per job.</li>
 *   <li><b>idx_job_runs_status_started</b> on {@code job_runs}: { status: 1, startedAt: -1 }
 *       <br/>Recent failed runs for the watchdog.</li>
 *   <li><b>idx_messages_out_due</b> on {@code messages_out}: { status: 1, nextAttemptAt: 1, createdAt: 1 }
 *       <br/>Due message scan of the outbound drain.</li>
 *   <li><b>ux_messages_out_dedupe_key</b> (unique + partial) on {@code messages_out}: { dedupeKey: 1 }
 *       with partialFilterExpression { dedupeKey: { $type: "string" } }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ status: 1, nextRunAt: 1, lockExpiresAt: 1 }, { name: "idx_jobs_due_claim" });
 * db.job_runs.createIndex({ jobId: 1, startedAt: -1 }, { name: "idx_job_runs_job_started" });
 * db.job_runs.createIndex({ status: 1, startedAt: -1 }, { name: "idx_job_runs_status_started" });
 * db.messages_out.createIndex({ status: 1, nextAttemptAt: 1, createdAt: 1 }, { name: "idx_messages_out_due" });
 * db.messages_out.createIndex(
 *   { dedupeKey: 1 },
 *   { name: "ux_messages_out_dedupe_key", unique: true, partialFilterExpression: { dedupeKey: { $type: "string" } } }
 * );
 * </pre>
 */
public class OttoMongoIndexConfig {

    public static final String IDX_JOBS_DUE_CLAIM = "idx_jobs_due_claim";
    public static final String IDX_JOB_RUNS_JOB_STARTED = "idx_job_runs_job_started";
    public static final String IDX_JOB_RUNS_STATUS_STARTED = "idx_job_runs_status_started";
    public static final String IDX_MESSAGES_OUT_DUE = "idx_messages_out_due";
    public static final String UX_MESSAGES_OUT_DEDUPE_KEY = "ux_messages_out_dedupe_key";

    private final MongoTemplate mongoTemplate;

    public OttoMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Ensure every index above. Safe to call repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).createIndex(jobsDueClaimIndex());
        mongoTemplate.indexOps(JobRunDocument.class).createIndex(jobRunsJobStartedIndex());
        mongoTemplate.indexOps(JobRunDocument.class).createIndex(jobRunsStatusStartedIndex());
        mongoTemplate.indexOps(OutboundMessageDocument.class).createIndex(messagesOutDueIndex());
        mongoTemplate.indexOps(OutboundMessageDocument.class).createIndex(dedupeKeyUniqueIndex());
    }

    public static Index jobsDueClaimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .on("lockExpiresAt", Sort.Direction.ASC)
                .named(IDX_JOBS_DUE_CLAIM);
    }

    public static Index jobRunsJobStartedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_RUNS_JOB_STARTED);
    }

    public static Index jobRunsStatusStartedIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_RUNS_STATUS_STARTED);
    }

    public static Index messagesOutDueIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextAttemptAt", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_MESSAGES_OUT_DUE);
    }

    /**
     * Unique index for outbound dedupe keys.
     * Keys: dedupeKey ASC
     * Options: unique + partialFilterExpression { dedupeKey: { $type: "string" } }
     */
    public static Index dedupeKeyUniqueIndex() {
        return new Index()
                .on("dedupeKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("dedupeKey", new Document("$type", "string"))))
                .named(UX_MESSAGES_OUT_DEDUPE_KEY);
    }
}
