package io.otto4j.heartbeat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.otto4j.core.Job;
import io.otto4j.core.JobStatus;
import io.otto4j.core.PersistResult;
import io.otto4j.core.ScheduleType;
import io.otto4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Installs the heartbeat as a recurring job. The job ticks often; {@link HeartbeatTask} decides on
 * each tick whether anything is due.
 */
public final class HeartbeatTasks {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatTasks.class);

    public static final String HEARTBEAT_TASK_ID = "system-heartbeat";
    public static final String HEARTBEAT_TASK_TYPE = "heartbeat";
    public static final int DEFAULT_CADENCE_MINUTES = 1;

    private HeartbeatTasks() {
    }

    public record EnsureResult(boolean created, String taskId, int cadenceMinutes) {
    }

    /**
     * Creates the heartbeat job unless it already exists. The first run is one cadence after {@code now}.
     *
     * @param cadenceMinutes job cadence, 1..60
     * @param chatId         recipient stored in the payload; null or non-positive falls back to the
     *                       executor's default at run time
     */
    public static EnsureResult ensureHeartbeatTask(JobStore jobStore,
                                                   int cadenceMinutes,
                                                   Long chatId,
                                                   ObjectMapper objectMapper,
                                                   Instant now) {
        Objects.requireNonNull(jobStore, "jobStore must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (cadenceMinutes < 1 || cadenceMinutes > 60) {
            throw new IllegalArgumentException("cadenceMinutes must be between 1 and 60");
        }

        if (jobStore.findById(HEARTBEAT_TASK_ID).isPresent()) {
            return new EnsureResult(false, HEARTBEAT_TASK_ID, cadenceMinutes);
        }

        ObjectNode payload = objectMapper.createObjectNode();
        if (chatId != null && chatId > 0) {
            payload.put("chatId", chatId);
        } else {
            payload.putNull("chatId");
        }

        Instant firstRunAt = now.plus(Duration.ofMinutes(cadenceMinutes));
        Job job = Job.builder()
                .id(HEARTBEAT_TASK_ID)
                .type(HEARTBEAT_TASK_TYPE)
                .status(JobStatus.IDLE)
                .scheduleType(ScheduleType.RECURRING)
                .runAt(firstRunAt)
                .cadenceMinutes(cadenceMinutes)
                .payload(payload.toString())
                .nextRunAt(firstRunAt)
                .createdAt(now)
                .updatedAt(now)
                .build();

        PersistResult result = jobStore.create(job);
        if (result.created()) {
            log.info("heartbeat task installed id={} cadenceMinutes={} firstRunAt={}",
                    HEARTBEAT_TASK_ID, cadenceMinutes, firstRunAt);
        }
        return new EnsureResult(result.created(), HEARTBEAT_TASK_ID, cadenceMinutes);
    }
}
