package io.otto4j.watchdog;

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
 * Installs the system watchdog as an ordinary recurring job so it survives restarts and runs through
 * the same claim and transition path as every other task.
 */
public final class WatchdogTasks {
    private static final Logger log = LoggerFactory.getLogger(WatchdogTasks.class);

    public static final String WATCHDOG_TASK_ID = "system-watchdog-failures";
    public static final String WATCHDOG_TASK_TYPE = "watchdog_failures";

    private WatchdogTasks() {
    }

    public record EnsureResult(boolean created, String taskId, int cadenceMinutes) {
    }

    /**
     * Creates the watchdog job unless it already exists. The first run is one cadence after {@code now}.
     */
    public static EnsureResult ensureWatchdogTask(JobStore jobStore,
                                                  WatchdogSettings settings,
                                                  ObjectMapper objectMapper,
                                                  Instant now) {
        Objects.requireNonNull(jobStore, "jobStore must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (jobStore.findById(WATCHDOG_TASK_ID).isPresent()) {
            return new EnsureResult(false, WATCHDOG_TASK_ID, settings.cadenceMinutes());
        }

        ObjectNode payload = objectMapper.createObjectNode()
                .put("lookbackMinutes", settings.lookbackMinutes())
                .put("maxFailures", settings.maxFailures())
                .put("threshold", settings.threshold())
                .put("notify", true);
        if (settings.chatId() != null) {
            payload.put("chatId", settings.chatId());
        }

        Instant firstRunAt = now.plus(Duration.ofMinutes(settings.cadenceMinutes()));
        Job job = Job.builder()
                .id(WATCHDOG_TASK_ID)
                .type(WATCHDOG_TASK_TYPE)
                .status(JobStatus.IDLE)
                .scheduleType(ScheduleType.RECURRING)
                .runAt(firstRunAt)
                .cadenceMinutes(settings.cadenceMinutes())
                .payload(payload.toString())
                .nextRunAt(firstRunAt)
                .createdAt(now)
                .updatedAt(now)
                .build();

        PersistResult result = jobStore.create(job);
        if (result.created()) {
            log.info("watchdog task installed id={} cadenceMinutes={} firstRunAt={}",
                    WATCHDOG_TASK_ID, settings.cadenceMinutes(), firstRunAt);
        }
        return new EnsureResult(result.created(), WATCHDOG_TASK_ID, settings.cadenceMinutes());
    }
}
