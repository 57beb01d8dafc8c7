package io.otto4j.watchdog;

import io.otto4j.core.FailedRun;
import io.otto4j.core.outbound.MessagePriority;
import io.otto4j.outbound.DedupeKeys;
import io.otto4j.outbound.EnqueueResult;
import io.otto4j.outbound.OutboundEnqueuer;
import io.otto4j.outbound.TextMessageRequest;
import io.otto4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Counts recent failed task runs and queues a deduplicated high-priority alert once a threshold is hit.
 *
 * <p>The alert's dedupe key is derived from the window parameters and the ids of the failed runs, so
 * repeated checks over the same failures never queue a second alert.
 */
public class FailureWatchdog {
    private static final Logger log = LoggerFactory.getLogger(FailureWatchdog.class);

    static final int MESSAGE_MAX_ITEMS = 10;

    private final JobStore jobStore;
    private final OutboundEnqueuer enqueuer;
    private final Long defaultChatId;

    /**
     * @param defaultChatId recipient used when the options carry none; may be null
     */
    public FailureWatchdog(JobStore jobStore, OutboundEnqueuer enqueuer, Long defaultChatId) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.enqueuer = Objects.requireNonNull(enqueuer, "enqueuer must not be null");
        this.defaultChatId = defaultChatId != null && defaultChatId > 0 ? defaultChatId : null;
    }

    public WatchdogReport check(WatchdogOptions options, Instant now) {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Instant since = now.minus(Duration.ofMinutes(options.lookbackMinutes()));
        List<FailedRun> failures = jobStore.listRecentFailedRuns(since, options.maxFailures()).stream()
                .filter(run -> !options.excludeTaskTypes().contains(run.jobType()))
                .collect(Collectors.toList());

        int failedCount = failures.size();
        boolean shouldAlert = failedCount >= options.threshold();

        if (!options.notifyRequested() || !shouldAlert) {
            return report(options, failures, shouldAlert, NotificationStatus.NOT_REQUESTED, null);
        }

        Long chatId = options.chatId() != null ? options.chatId() : defaultChatId;
        if (chatId == null) {
            log.warn("watchdog alert due but no chat id is configured failedCount={} threshold={}",
                    failedCount, options.threshold());
            return report(options, failures, true, NotificationStatus.NOTIFICATION_UNAVAILABLE, null);
        }

        String dedupeKey = dedupeKey(failures, options.lookbackMinutes(), options.threshold());
        EnqueueResult result = enqueuer.enqueueText(
                new TextMessageRequest(
                        chatId,
                        alertMessage(failures, options.lookbackMinutes(), options.threshold()),
                        dedupeKey,
                        MessagePriority.HIGH
                ),
                now
        );

        NotificationStatus status = result.isDuplicate() ? NotificationStatus.DUPLICATE : NotificationStatus.ENQUEUED;
        log.info("watchdog alert processed failedCount={} threshold={} status={} dedupeKey={}",
                failedCount, options.threshold(), status.value(), dedupeKey);
        return report(options, failures, true, status, dedupeKey);
    }

    private static WatchdogReport report(WatchdogOptions options,
                                         List<FailedRun> failures,
                                         boolean shouldAlert,
                                         NotificationStatus status,
                                         String dedupeKey) {
        return new WatchdogReport(
                options.lookbackMinutes(),
                options.maxFailures(),
                options.threshold(),
                failures.size(),
                shouldAlert,
                status == NotificationStatus.ENQUEUED,
                status,
                dedupeKey,
                failures
        );
    }

    static String alertMessage(List<FailedRun> failures, int lookbackMinutes, int threshold) {
        StringBuilder sb = new StringBuilder()
                .append("Watchdog alert: ").append(failures.size())
                .append(" failed task runs in last ").append(lookbackMinutes)
                .append("m (threshold ").append(threshold).append(").");
        failures.stream().limit(MESSAGE_MAX_ITEMS).forEach(failure -> {
            String reason = failure.errorMessage() != null ? failure.errorMessage()
                    : failure.errorCode() != null ? failure.errorCode() : "unknown error";
            sb.append('\n').append("- ").append(failure.jobType())
                    .append(" (").append(failure.jobId()).append("): ").append(reason);
        });
        return sb.toString();
    }

    static String dedupeKey(List<FailedRun> failures, int lookbackMinutes, int threshold) {
        String fingerprint = failures.stream().map(FailedRun::runId).collect(Collectors.joining("|"));
        String hash = DedupeKeys.sha256Hex(fingerprint).substring(0, 20);
        return "watchdog:task-failures:" + lookbackMinutes + ":" + threshold + ":" + hash;
    }
}
