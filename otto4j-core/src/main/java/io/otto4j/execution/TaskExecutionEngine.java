package io.otto4j.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.otto4j.core.Job;
import io.otto4j.core.JobRun;
import io.otto4j.heartbeat.HeartbeatReport;
import io.otto4j.heartbeat.HeartbeatTask;
import io.otto4j.schedule.ScheduleTransition;
import io.otto4j.schedule.ScheduleTransitionResolver;
import io.otto4j.spi.JobStore;
import io.otto4j.spi.PromptOptions;
import io.otto4j.spi.SessionBindingStore;
import io.otto4j.spi.SessionGateway;
import io.otto4j.taskconfig.EffectiveTaskConfig;
import io.otto4j.taskconfig.ExecutionLane;
import io.otto4j.taskconfig.TaskConfigLoader;
import io.otto4j.watchdog.FailureWatchdog;
import io.otto4j.watchdog.NotificationStatus;
import io.otto4j.watchdog.WatchdogReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Runs one claimed job to completion.
 *
 * <p>For every claimed job the engine:
 * <ol>
 *   <li>inserts a placeholder run</li>
 *   <li>executes the job: the failure watchdog or the heartbeat for those system types, otherwise a
 *       prompt to the gateway in the job's bound session</li>
 *   <li>finalizes the run with the mapped status and the serialized result</li>
 *   <li>applies the schedule transition, falling back to releasing the lock if that fails</li>
 * </ol>
 *
 * <p>Gateway, payload and config failures become a failed run and never propagate. Only store
 * failures and a claimed job without a lock token escape.
 */
public class TaskExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutionEngine.class);

    public static final String TASK_EXECUTION_ERROR = "task_execution_error";
    public static final String WATCHDOG_NOTIFICATION_UNAVAILABLE = "watchdog_notification_unavailable";

    private final JobStore jobStore;
    private final SessionGateway sessionGateway;
    private final SessionBindingStore sessionBindings;
    private final TaskConfigLoader taskConfigLoader;
    private final FailureWatchdog watchdog;
    private final HeartbeatTask heartbeat;
    private final ObjectMapper objectMapper;
    private final TaskResultParser resultParser;
    private final Clock clock;

    public TaskExecutionEngine(JobStore jobStore,
                               SessionGateway sessionGateway,
                               SessionBindingStore sessionBindings,
                               TaskConfigLoader taskConfigLoader,
                               FailureWatchdog watchdog,
                               HeartbeatTask heartbeat,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.sessionGateway = Objects.requireNonNull(sessionGateway, "sessionGateway must not be null");
        this.sessionBindings = Objects.requireNonNull(sessionBindings, "sessionBindings must not be null");
        this.taskConfigLoader = Objects.requireNonNull(taskConfigLoader, "taskConfigLoader must not be null");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog must not be null");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.resultParser = new TaskResultParser(objectMapper);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return the finalized run
     * @throws IllegalStateException when the job carries no lock token
     */
    public JobRun executeClaimedJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        String lockToken = job.lockToken();
        if (lockToken == null || lockToken.isBlank()) {
            throw new IllegalStateException("Claimed job " + job.id() + " is missing lock token");
        }

        Instant startedAt = clock.instant();
        String runId = UUID.randomUUID().toString();
        jobStore.insertRun(JobRun.placeholder(runId, job.id(), job.nextRunAt(), startedAt));
        log.debug("task run started jobId={} runId={} type={}", job.id(), runId, job.type());

        TaskResult result;
        String rawOutput = null;
        try {
            ResultParseOutcome outcome = execute(job, startedAt);
            result = outcome.result();
            rawOutput = outcome.rawOutput();
        } catch (InvalidTaskPayloadException e) {
            log.warn("task payload rejected jobId={} code={} msg={}", job.id(), e.code(), e.getMessage());
            result = TaskResult.failure(e.code(), e.getMessage());
        } catch (Exception e) {
            log.error("task execution failed jobId={} msg={}", job.id(), e.getMessage(), e);
            result = TaskResult.failure(TASK_EXECUTION_ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }

        Instant finishedAt = clock.instant();
        String resultJson = serialize(result, rawOutput);
        jobStore.markRunFinished(runId, result.status(), finishedAt, result.runErrorCode(), result.runErrorMessage(), resultJson);
        log.info("task run finished jobId={} runId={} status={} errorCode={}",
                job.id(), runId, result.status().value(), result.runErrorCode());

        applyTransition(job, lockToken, finishedAt);

        return new JobRun(runId, job.id(), job.nextRunAt(), startedAt, finishedAt, result.status(),
                result.runErrorCode(), result.runErrorMessage(), resultJson, startedAt);
    }

    private ResultParseOutcome execute(Job job, Instant startedAt) throws Exception {
        TaskPayload payload = TaskPayloads.interpret(job, objectMapper);
        if (payload instanceof TaskPayload.Watchdog watchdogPayload) {
            return new ResultParseOutcome.Parsed(runWatchdog(watchdogPayload, startedAt));
        }
        if (payload instanceof TaskPayload.Heartbeat heartbeatPayload) {
            HeartbeatReport report = heartbeat.execute(heartbeatPayload.chatId(), startedAt);
            return new ResultParseOutcome.Parsed(TaskResult.success(report.summary()));
        }
        return promptAssistant(job, (TaskPayload.Assistant) payload, startedAt);
    }

    private TaskResult runWatchdog(TaskPayload.Watchdog payload, Instant now) {
        WatchdogReport report = watchdog.check(payload.options(), now);
        if (report.shouldAlert() && report.notificationStatus() == NotificationStatus.NOTIFICATION_UNAVAILABLE) {
            return TaskResult.failure(WATCHDOG_NOTIFICATION_UNAVAILABLE,
                    "Watchdog detected failures but no chat id is configured for alerts");
        }
        String notification = report.notificationStatus() == NotificationStatus.NOT_REQUESTED
                ? "notification skipped"
                : "notification " + report.notificationStatus().value();
        return TaskResult.success("Watchdog checked " + report.failedCount() + " failed runs (" + notification + ")");
    }

    private ResultParseOutcome promptAssistant(Job job, TaskPayload.Assistant payload, Instant startedAt) throws Exception {
        EffectiveTaskConfig config = taskConfigLoader.loadEffectiveConfig(ExecutionLane.SCHEDULED, job.profileId());

        String bindingKey = sessionBindingKey(job.id());
        String existingSessionId = sessionBindings.findSessionId(bindingKey).orElse(null);
        String sessionId = sessionGateway.ensureSession(existingSessionId);
        if (!Objects.equals(existingSessionId, sessionId)) {
            sessionBindings.upsert(bindingKey, sessionId, clock.instant());
        }

        String output = sessionGateway.promptSession(
                sessionId,
                ExecutionPrompt.build(job, payload.payload(), startedAt, objectMapper),
                new PromptOptions(config.assistantPrompt(), config.assistantTools(), EffectiveTaskConfig.ASSISTANT_AGENT)
        );

        ResultParseOutcome outcome = resultParser.parse(output);
        if (outcome instanceof ResultParseOutcome.ParseFailed failure) {
            log.warn("task execution returned non-conforming output jobId={} code={} reason={}",
                    job.id(), failure.code(), failure.reason());
        }
        return outcome;
    }

    private void applyTransition(Job job, String lockToken, Instant finishedAt) {
        try {
            ScheduleTransition transition = ScheduleTransitionResolver.resolve(job, finishedAt);
            boolean applied;
            if (transition instanceof ScheduleTransition.Reschedule reschedule) {
                applied = jobStore.rescheduleRecurring(job.id(), lockToken, reschedule.lastRunAt(), reschedule.nextRunAt(), finishedAt);
            } else {
                ScheduleTransition.Finalize finalize = (ScheduleTransition.Finalize) transition;
                applied = jobStore.finalizeOneShot(job.id(), lockToken, finalize.terminalState(),
                        finalize.terminalReason(), finalize.lastRunAt(), finishedAt);
            }
            if (!applied) {
                log.warn("task lock was taken over before the schedule transition jobId={}", job.id());
            }
        } catch (Exception e) {
            log.error("task post-run scheduling transition failed jobId={} msg={}", job.id(), e.getMessage(), e);
            jobStore.releaseLock(job.id(), lockToken, finishedAt);
        }
    }

    private String serialize(TaskResult result, String rawOutput) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("status", result.status().value());
        node.put("summary", result.summary());
        ArrayNode errors = node.putArray("errors");
        for (TaskError error : result.errors()) {
            errors.addObject().put("code", error.code()).put("message", error.message());
        }
        if (rawOutput != null) {
            node.put("rawOutput", rawOutput);
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize task result", e);
        }
    }

    public static String sessionBindingKey(String jobId) {
        return "scheduler:task:" + jobId + ":assistant";
    }
}
