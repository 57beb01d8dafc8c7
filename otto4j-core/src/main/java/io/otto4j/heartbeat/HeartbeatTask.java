package io.otto4j.heartbeat;

import io.otto4j.core.RunStatus;
import io.otto4j.core.RunSummary;
import io.otto4j.core.outbound.MessagePriority;
import io.otto4j.core.outbound.NotificationPolicy;
import io.otto4j.outbound.DedupeKeys;
import io.otto4j.outbound.EnqueueResult;
import io.otto4j.outbound.NotificationGate;
import io.otto4j.outbound.OutboundEnqueuer;
import io.otto4j.outbound.TextMessageRequest;
import io.otto4j.spi.JobStore;
import io.otto4j.spi.NotificationPolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Friendly activity summary sent at the morning, midday and evening windows of the notification
 * policy, or whenever a cadence slot closes.
 *
 * <p>One tick, in order:
 * <ol>
 *   <li>without a recipient, nothing happens</li>
 *   <li>an incomplete profile gets a once-a-day onboarding prompt instead</li>
 *   <li>outside every window and cadence slot, nothing happens</li>
 *   <li>with {@code onlyIfSignal} and no runs in the last cadence, nothing happens</li>
 *   <li>while quiet hours or a mute hold normal messages, nothing happens</li>
 *   <li>otherwise a summary is queued, deduplicated per window or slot, and the digest time recorded</li>
 * </ol>
 */
public class HeartbeatTask {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatTask.class);

    static final int WINDOW_LENGTH_MINUTES = 60;
    static final Duration CADENCE_SLOT_LEAD = Duration.ofSeconds(60);
    static final int MAX_RECENT_RUNS = 100;

    static final String ONBOARDING_TEXT = String.join("\n",
            "I can start friendly heartbeat updates, but your notification profile is not configured yet.",
            "Suggested defaults: timezone Europe/Vienna, quiet hours 20:00-08:00, and morning/midday/evening heartbeats at 08:30 / 12:30 / 19:00.",
            "Tell me in plain language what you prefer, for example: 'mute until tomorrow 08:00', 'quiet hours 21:00-07:30', or 'only notify me when there is meaningful change'.");

    private final JobStore jobStore;
    private final OutboundEnqueuer enqueuer;
    private final NotificationPolicyStore policyStore;
    private final Long defaultChatId;

    /**
     * @param defaultChatId recipient used when the payload carries none; may be null
     */
    public HeartbeatTask(JobStore jobStore,
                         OutboundEnqueuer enqueuer,
                         NotificationPolicyStore policyStore,
                         Long defaultChatId) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.enqueuer = Objects.requireNonNull(enqueuer, "enqueuer must not be null");
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore must not be null");
        this.defaultChatId = defaultChatId != null && defaultChatId > 0 ? defaultChatId : null;
    }

    public HeartbeatReport execute(Long payloadChatId, Instant startedAt) {
        Objects.requireNonNull(startedAt, "startedAt must not be null");

        Long chatId = payloadChatId != null && payloadChatId > 0 ? payloadChatId : defaultChatId;
        if (chatId == null) {
            return HeartbeatReport.skipped(HeartbeatReport.Reason.NO_CHAT_ID,
                    "Heartbeat skipped because no chat id is configured.");
        }

        NotificationPolicy policy = policyStore.get().orElse(null);
        HeartbeatProfile profile = HeartbeatProfile.of(policy);
        ZonedDateTime local = ZonedDateTime.ofInstant(startedAt, profile.zone());
        LocalDate localDate = local.toLocalDate();

        if (policy == null || !policy.isOnboardingComplete()) {
            return promptOnboarding(chatId, localDate, startedAt);
        }

        String window = dueWindow(local.toLocalTime(), profile);
        long bucket = cadenceBucket(startedAt, profile.cadenceMinutes());
        boolean cadenceDue = isCadenceSlotClosing(startedAt, profile.cadenceMinutes());
        if (window == null && !cadenceDue) {
            return HeartbeatReport.skipped(HeartbeatReport.Reason.OUTSIDE_CADENCE,
                    "Heartbeat skipped because no window or cadence slot is currently due.");
        }

        Instant since = startedAt.minus(Duration.ofMinutes(profile.cadenceMinutes()));
        List<RunSummary> recentRuns = jobStore.listRecentRuns(since, MAX_RECENT_RUNS).stream()
                .filter(run -> !HeartbeatTasks.HEARTBEAT_TASK_TYPE.equals(run.jobType()))
                .collect(Collectors.toList());
        if (profile.onlyIfSignal() && recentRuns.isEmpty()) {
            return HeartbeatReport.skipped(HeartbeatReport.Reason.SIGNAL_EMPTY,
                    "Heartbeat skipped because there is no new signal to report.");
        }

        if (NotificationGate.evaluate(policy, MessagePriority.NORMAL, startedAt).isHold()) {
            return HeartbeatReport.skipped(HeartbeatReport.Reason.QUIET_OR_MUTED,
                    "Heartbeat held due to current quiet or mute policy.");
        }

        String fingerprint = window != null
                ? localDate + ":" + window
                : localDate + ":cadence-" + profile.cadenceMinutes() + "-" + bucket;
        String header = window != null
                ? "Friendly " + window + " heartbeat:"
                : "Friendly heartbeat (" + profile.cadenceMinutes() + " minute cadence):";
        String dedupeKey = dedupeKey("heartbeat", chatId, fingerprint);

        EnqueueResult result = enqueuer.enqueueText(
                new TextMessageRequest(chatId, header + "\n" + summarizeRuns(recentRuns), dedupeKey, MessagePriority.NORMAL),
                startedAt
        );
        policyStore.setLastDigestAt(startedAt, startedAt);

        String status = result.isDuplicate() ? "duplicate" : "enqueued";
        log.info("heartbeat processed chatId={} window={} status={} recentRuns={}",
                chatId, window != null ? window : "cadence", status, recentRuns.size());
        return new HeartbeatReport(
                result.isDuplicate() ? HeartbeatReport.Reason.DEDUPE : HeartbeatReport.Reason.QUEUED,
                !result.isDuplicate(),
                "Heartbeat " + status + " for " + (window != null ? window : "cadence") + " window.",
                result.isDuplicate() ? null : dedupeKey
        );
    }

    private HeartbeatReport promptOnboarding(long chatId, LocalDate localDate, Instant now) {
        String dedupeKey = dedupeKey("heartbeat-onboarding", chatId, localDate + ":onboarding");
        EnqueueResult result = enqueuer.enqueueText(
                new TextMessageRequest(chatId, ONBOARDING_TEXT, dedupeKey, MessagePriority.NORMAL), now);
        String status = result.isDuplicate() ? "duplicate" : "enqueued";
        log.info("heartbeat onboarding prompt processed chatId={} status={}", chatId, status);
        return new HeartbeatReport(
                HeartbeatReport.Reason.ONBOARDING_NEEDED,
                !result.isDuplicate(),
                "Heartbeat onboarding prompt " + status + ".",
                result.isDuplicate() ? null : dedupeKey
        );
    }

    /**
     * @return {@code morning}, {@code midday} or {@code evening} when {@code now} falls in the hour
     *         starting at that window's time, checked in that order; otherwise null
     */
    static String dueWindow(LocalTime now, HeartbeatProfile profile) {
        int nowMinutes = now.getHour() * 60 + now.getMinute();
        Map<String, LocalTime> windows = new LinkedHashMap<>();
        windows.put("morning", profile.morning());
        windows.put("midday", profile.midday());
        windows.put("evening", profile.evening());
        for (Map.Entry<String, LocalTime> window : windows.entrySet()) {
            int start = window.getValue().getHour() * 60 + window.getValue().getMinute();
            if (nowMinutes >= start && nowMinutes < start + WINDOW_LENGTH_MINUTES) {
                return window.getKey();
            }
        }
        return null;
    }

    static long cadenceBucket(Instant now, int cadenceMinutes) {
        return Math.floorDiv(now.toEpochMilli(), Duration.ofMinutes(cadenceMinutes).toMillis());
    }

    /**
     * A cadence slot is due during the last minute before its boundary.
     */
    static boolean isCadenceSlotClosing(Instant now, int cadenceMinutes) {
        long cadenceMs = Duration.ofMinutes(cadenceMinutes).toMillis();
        long nextBoundary = (cadenceBucket(now, cadenceMinutes) + 1) * cadenceMs;
        return nextBoundary - now.toEpochMilli() <= CADENCE_SLOT_LEAD.toMillis();
    }

    static String summarizeRuns(List<RunSummary> runs) {
        if (runs.isEmpty()) {
            return "No task activity in the recent window.";
        }

        Map<String, Integer> byType = new LinkedHashMap<>();
        for (RunSummary run : runs) {
            byType.merge(run.jobType(), 1, Integer::sum);
        }
        String topTypes = byType.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(3)
                .map(entry -> entry.getKey() + " (" + entry.getValue() + ")")
                .collect(Collectors.joining(", "));
        List<String> issues = runs.stream()
                .filter(run -> run.status() == RunStatus.FAILED)
                .limit(2)
                .map(run -> run.errorMessage() != null ? run.errorMessage()
                        : run.errorCode() != null ? run.errorCode() : "Unknown failure")
                .collect(Collectors.toList());

        List<String> lines = new ArrayList<>();
        lines.add("Recent task activity: " + runs.size() + " runs (" + count(runs, RunStatus.SUCCESS) + " success, "
                + count(runs, RunStatus.FAILED) + " failed, " + count(runs, RunStatus.SKIPPED) + " skipped).");
        lines.add("Most active: " + topTypes + ".");
        if (!issues.isEmpty()) {
            lines.add("Top issues: " + String.join(" | ", issues) + ".");
        }
        return String.join("\n", lines);
    }

    static long count(List<RunSummary> runs, RunStatus status) {
        return runs.stream().filter(run -> run.status() == status).count();
    }

    static String dedupeKey(String kind, long chatId, String fingerprint) {
        return kind + ":" + DedupeKeys.sha256Hex(chatId + ":" + fingerprint).substring(0, 16);
    }
}
