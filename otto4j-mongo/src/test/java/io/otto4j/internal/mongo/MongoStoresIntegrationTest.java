package io.otto4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.otto4j.config.OttoMongoIndexConfig;
import io.otto4j.core.FailedRun;
import io.otto4j.core.Job;
import io.otto4j.core.JobRun;
import io.otto4j.core.JobStatus;
import io.otto4j.core.RunStatus;
import io.otto4j.core.RunSummary;
import io.otto4j.core.ScheduleType;
import io.otto4j.core.TerminalState;
import io.otto4j.core.outbound.MessagePriority;
import io.otto4j.core.outbound.NotificationPolicy;
import io.otto4j.core.outbound.OutboundMessage;
import io.otto4j.core.outbound.OutboundStatus;
import io.otto4j.core.outbound.QuietMode;
import io.otto4j.spi.EnqueueOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2025-03-01T09:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(5);

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;
    private MongoOutboundMessageStore outboundStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "otto4j_test");
        dropAll();
        new OttoMongoIndexConfig(mongoTemplate).ensureIndexes();
        jobStore = new MongoJobStore(mongoTemplate);
        outboundStore = new MongoOutboundMessageStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void claimDueShouldLockAndPreventDoubleClaim() {
        jobStore.create(oneshot("job-1", T0.minusSeconds(5)));

        List<Job> claimed = jobStore.claimDue(T0, 1, "token-A", LEASE, T0);

        assertEquals(1, claimed.size());
        Job locked = claimed.get(0);
        assertEquals(JobStatus.RUNNING, locked.status());
        assertEquals("token-A", locked.lockToken());
        assertEquals(T0.plus(LEASE), locked.lockExpiresAt());

        assertTrue(jobStore.claimDue(T0, 1, "token-B", LEASE, T0).isEmpty());
    }

    @Test
    void claimDueShouldReclaimExpiredLease() {
        jobStore.create(oneshot("job-1", T0.minusSeconds(5)));
        jobStore.claimDue(T0, 1, "token-A", LEASE, T0);

        Instant later = T0.plus(LEASE).plusSeconds(1);
        List<Job> reclaimed = jobStore.claimDue(later, 1, "token-B", LEASE, later);

        assertEquals(1, reclaimed.size());
        assertEquals("token-B", reclaimed.get(0).lockToken());

        // the first owner lost its lock and cannot write back
        assertFalse(jobStore.releaseLock("job-1", "token-A", later));
        assertTrue(jobStore.releaseLock("job-1", "token-B", later));
    }

    @Test
    void claimDueShouldSkipPausedFutureAndTerminalJobs() {
        jobStore.create(oneshot("future", T0.plusSeconds(60)));
        jobStore.create(oneshot("paused", T0.minusSeconds(60)).toBuilder().status(JobStatus.PAUSED).build());
        jobStore.create(oneshot("done", T0.minusSeconds(60)).toBuilder()
                .terminalState(TerminalState.COMPLETED).build());
        jobStore.create(oneshot("due", T0.minusSeconds(1)));

        List<Job> claimed = jobStore.claimDue(T0, 10, "token-A", LEASE, T0);

        assertEquals(1, claimed.size());
        assertEquals("due", claimed.get(0).id());
    }

    @Test
    void createShouldReportExistingJob() {
        assertTrue(jobStore.create(oneshot("job-1", T0)).created());
        assertFalse(jobStore.create(oneshot("job-1", T0)).created());
    }

    @Test
    void rescheduleRecurringShouldUnlockAndMoveNextRun() {
        Job recurring = Job.builder()
                .id("rec-1")
                .type("task")
                .scheduleType(ScheduleType.RECURRING)
                .cadenceMinutes(15)
                .payload("{}")
                .nextRunAt(T0.minusSeconds(1))
                .createdAt(T0)
                .updatedAt(T0)
                .build();
        jobStore.create(recurring);
        jobStore.claimDue(T0, 1, "token-A", LEASE, T0);

        Instant next = T0.plus(Duration.ofMinutes(15));
        assertTrue(jobStore.rescheduleRecurring("rec-1", "token-A", T0, next, T0));

        Job stored = jobStore.findById("rec-1").orElseThrow();
        assertEquals(JobStatus.IDLE, stored.status());
        assertEquals(next, stored.nextRunAt());
        assertEquals(T0, stored.lastRunAt());
        assertNull(stored.lockToken());
        assertNull(stored.lockExpiresAt());
    }

    @Test
    void finalizeOneShotShouldWriteTerminalStateOnce() {
        jobStore.create(oneshot("job-1", T0.minusSeconds(1)));
        jobStore.claimDue(T0, 1, "token-A", LEASE, T0);

        assertFalse(jobStore.finalizeOneShot("job-1", "stale", TerminalState.COMPLETED, "done", T0, T0));
        assertFalse(jobStore.finalizeOneShot("job-1", null, TerminalState.COMPLETED, "done", T0, T0));
        assertTrue(jobStore.finalizeOneShot("job-1", "token-A", TerminalState.COMPLETED, "done", T0, T0));

        Job stored = jobStore.findById("job-1").orElseThrow();
        assertEquals(TerminalState.COMPLETED, stored.terminalState());
        assertEquals("done", stored.terminalReason());
        assertNull(stored.nextRunAt());
        assertNull(stored.lockToken());

        assertFalse(jobStore.cancel("job-1", "late", T0));
    }

    @Test
    void setPausedShouldToggleIdleJobs() {
        jobStore.create(oneshot("job-1", T0.plusSeconds(60)));

        assertTrue(jobStore.setPaused("job-1", true, T0));
        assertEquals(JobStatus.PAUSED, jobStore.findById("job-1").orElseThrow().status());
        assertTrue(jobStore.setPaused("job-1", false, T0));
        assertEquals(JobStatus.IDLE, jobStore.findById("job-1").orElseThrow().status());
    }

    @Test
    void runAuditShouldFinalizeOnceAndJoinJobTypes() {
        jobStore.create(oneshot("job-1", T0));
        jobStore.insertRun(JobRun.placeholder("run-1", "job-1", T0, T0));
        jobStore.insertRun(JobRun.placeholder("run-2", "ghost", T0, T0.plusSeconds(1)));

        assertTrue(jobStore.markRunFinished("run-1", RunStatus.FAILED, T0.plusSeconds(2),
                "task_execution_error", "boom", null));
        assertFalse(jobStore.markRunFinished("run-1", RunStatus.SUCCESS, T0.plusSeconds(3),
                null, null, "{}"));
        assertTrue(jobStore.markRunFinished("run-2", RunStatus.FAILED, T0.plusSeconds(2),
                "task_execution_error", "gone", null));

        List<JobRun> runs = jobStore.listRunsByJobId("job-1", 10);
        assertEquals(1, runs.size());
        assertEquals(RunStatus.FAILED, runs.get(0).status());

        List<FailedRun> failed = jobStore.listRecentFailedRuns(T0.minusSeconds(60), 10);
        assertEquals(2, failed.size());
        assertEquals("run-2", failed.get(0).runId());
        assertEquals("unknown", failed.get(0).jobType());
        assertEquals("task", failed.get(1).jobType());
        assertEquals("boom", failed.get(1).errorMessage());
    }

    @Test
    void recentRunsShouldIncludeEveryStatusNewestFirst() {
        jobStore.create(oneshot("job-1", T0));
        jobStore.insertRun(JobRun.placeholder("run-old", "job-1", T0, T0.minusSeconds(3600)));
        jobStore.insertRun(JobRun.placeholder("run-1", "job-1", T0, T0));
        jobStore.insertRun(JobRun.placeholder("run-2", "ghost", T0, T0.plusSeconds(1)));
        jobStore.insertRun(JobRun.placeholder("run-3", "job-1", T0, T0.plusSeconds(2)));
        jobStore.markRunFinished("run-1", RunStatus.SUCCESS, T0.plusSeconds(5), null, null, "{}");
        jobStore.markRunFinished("run-2", RunStatus.FAILED, T0.plusSeconds(5), "task_failed", "boom", null);

        List<RunSummary> runs = jobStore.listRecentRuns(T0.minusSeconds(60), 10);

        assertEquals(List.of("run-3", "run-2", "run-1"), runs.stream().map(RunSummary::runId).collect(Collectors.toList()));
        assertNull(runs.get(0).finishedAt());
        assertEquals(RunStatus.SKIPPED, runs.get(0).status());
        assertEquals("unknown", runs.get(1).jobType());
        assertEquals("boom", runs.get(1).errorMessage());
        assertEquals(RunStatus.SUCCESS, runs.get(2).status());
        assertEquals("task", runs.get(2).jobType());
        assertEquals(1, jobStore.listRecentRuns(T0.minusSeconds(60), 1).size());
    }

    @Test
    void enqueueShouldIgnoreDuplicateDedupeKey() {
        EnqueueOutcome first = outboundStore.enqueueOrIgnoreDedupe(
                OutboundMessage.queuedText("msg-1", "alert:1", 42L, "hello", MessagePriority.NORMAL, T0));
        EnqueueOutcome second = outboundStore.enqueueOrIgnoreDedupe(
                OutboundMessage.queuedText("msg-2", "alert:1", 42L, "hello again", MessagePriority.NORMAL, T0));
        EnqueueOutcome noKey1 = outboundStore.enqueueOrIgnoreDedupe(
                OutboundMessage.queuedText("msg-3", null, 42L, "a", MessagePriority.NORMAL, T0));
        EnqueueOutcome noKey2 = outboundStore.enqueueOrIgnoreDedupe(
                OutboundMessage.queuedText("msg-4", null, 42L, "b", MessagePriority.NORMAL, T0));

        assertFalse(first.duplicate());
        assertEquals("msg-1", first.messageId());
        assertTrue(second.duplicate());
        assertFalse(noKey1.duplicate());
        assertFalse(noKey2.duplicate());
        assertTrue(outboundStore.findById("msg-2").isEmpty());
    }

    @Test
    void listDueShouldReturnQueuedRowsInCreationOrder() {
        outboundStore.enqueueOrIgnoreDedupe(
                OutboundMessage.queuedText("late", null, 1L, "b", MessagePriority.NORMAL, T0.plusSeconds(1)));
        outboundStore.enqueueOrIgnoreDedupe(
                OutboundMessage.queuedText("early", null, 1L, "a", MessagePriority.HIGH, T0));
        outboundStore.enqueueOrIgnoreDedupe(
                OutboundMessage.queuedText("retrying", null, 1L, "c", MessagePriority.NORMAL, T0));
        outboundStore.markRetry("retrying", 1, T0.plusSeconds(600), "timeout", T0);

        List<OutboundMessage> due = outboundStore.listDue(T0.plusSeconds(5));

        assertEquals(List.of("early", "late"), due.stream().map(OutboundMessage::id).toList());
    }

    @Test
    void terminalRowsShouldNotBeMutated() {
        outboundStore.enqueueOrIgnoreDedupe(
                OutboundMessage.queuedText("msg-1", null, 1L, "a", MessagePriority.NORMAL, T0));

        assertTrue(outboundStore.markSent("msg-1", 1, T0.plusSeconds(1)));
        assertFalse(outboundStore.markFailed("msg-1", 2, "late", T0.plusSeconds(2)));
        assertFalse(outboundStore.cancel("msg-1", T0.plusSeconds(2)));

        OutboundMessage stored = outboundStore.findById("msg-1").orElseThrow();
        assertEquals(OutboundStatus.SENT, stored.status());
        assertEquals(1, stored.attemptCount());
        assertNotNull(stored.sentAt());
        assertNull(stored.failedAt());
    }

    @Test
    void sessionBindingShouldUpsert() {
        MongoSessionBindingStore bindings = new MongoSessionBindingStore(mongoTemplate);

        assertTrue(bindings.findSessionId("task:job-1").isEmpty());
        bindings.upsert("task:job-1", "session-a", T0);
        bindings.upsert("task:job-1", "session-b", T0.plusSeconds(1));

        assertEquals("session-b", bindings.findSessionId("task:job-1").orElseThrow());
    }

    @Test
    void policyStoreShouldMapStoredDocument() {
        MongoNotificationPolicyStore reader = new MongoNotificationPolicyStore(mongoTemplate);
        assertTrue(reader.get().isEmpty());

        NotificationPolicyDocument doc = new NotificationPolicyDocument();
        doc.setId(MongoNotificationPolicyStore.POLICY_ID);
        doc.setTimezone("Europe/Berlin");
        doc.setQuietHoursStart("22:00");
        doc.setQuietHoursEnd("07:00");
        doc.setQuietMode(QuietMode.CRITICAL_ONLY);
        doc.setUpdatedAt(T0);
        mongoTemplate.insert(doc);

        NotificationPolicy policy = reader.get().orElseThrow();
        assertEquals("Europe/Berlin", policy.timezone());
        assertEquals("22:00", policy.quietHoursStart());
        assertEquals("07:00", policy.quietHoursEnd());
        assertEquals(QuietMode.CRITICAL_ONLY, policy.quietMode());
        assertNull(policy.muteUntil());
        assertNull(policy.heartbeatOnlyIfSignal());
        assertTrue(policy.isOnboardingComplete());
    }

    @Test
    void setLastDigestAtShouldUpsertAndKeepOtherFields() {
        MongoNotificationPolicyStore store = new MongoNotificationPolicyStore(mongoTemplate);

        store.setLastDigestAt(T0, T0);
        NotificationPolicy created = store.get().orElseThrow();
        assertEquals(T0, created.lastDigestAt());
        assertFalse(created.isOnboardingComplete());

        NotificationPolicyDocument doc = mongoTemplate.findById(MongoNotificationPolicyStore.POLICY_ID,
                NotificationPolicyDocument.class);
        doc.setTimezone("Europe/Berlin");
        doc.setHeartbeatOnlyIfSignal(false);
        mongoTemplate.save(doc);

        store.setLastDigestAt(T0.plusSeconds(60), T0.plusSeconds(60));
        NotificationPolicy updated = store.get().orElseThrow();
        assertEquals(T0.plusSeconds(60), updated.lastDigestAt());
        assertEquals(T0.plusSeconds(60), updated.updatedAt());
        assertEquals("Europe/Berlin", updated.timezone());
        assertEquals(Boolean.FALSE, updated.heartbeatOnlyIfSignal());
    }

    private void dropAll() {
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(JobRunDocument.class);
        mongoTemplate.dropCollection(OutboundMessageDocument.class);
        mongoTemplate.dropCollection(SessionBindingDocument.class);
        mongoTemplate.dropCollection(NotificationPolicyDocument.class);
    }

    private static Job oneshot(String id, Instant runAt) {
        return Job.builder()
                .id(id)
                .type("task")
                .scheduleType(ScheduleType.ONESHOT)
                .runAt(runAt)
                .payload("{}")
                .nextRunAt(runAt)
                .createdAt(T0)
                .updatedAt(T0)
                .build();
    }
}
