package io.otto4j.outbound;

import io.otto4j.core.RunSummary;
import io.otto4j.core.outbound.MessagePriority;
import io.otto4j.core.outbound.NotificationPolicy;
import io.otto4j.core.outbound.OutboundMessage;
import io.otto4j.heartbeat.HeartbeatTasks;
import io.otto4j.spi.JobStore;
import io.otto4j.spi.MediaAttachment;
import io.otto4j.spi.NotificationPolicyStore;
import io.otto4j.spi.OutboundMessageStore;
import io.otto4j.spi.TransportSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Drains due outbound messages through the transport, one message at a time in creation order.
 *
 * <p>When run history is available and normal messages may be delivered again, due messages that an
 * earlier drain held back are first collapsed into one quiet-period digest per chat and marked sent.
 *
 * <p>Per remaining message:
 * <ul>
 *   <li>held by the notification policy: retried later with a {@code suppressed_by_policy:} error,
 *       consuming an attempt</li>
 *   <li>delivered: marked sent</li>
 *   <li>transport failure: retried with backoff while attempts remain, otherwise marked failed</li>
 * </ul>
 *
 * <p>Transport errors never escape a drain; store errors do.
 */
public class OutboundQueueProcessor {
    private static final Logger log = LoggerFactory.getLogger(OutboundQueueProcessor.class);

    public static final String SUPPRESSED_PREFIX = "suppressed_by_policy:";
    static final int MAX_ERROR_MESSAGE_LENGTH = 1000;
    static final int MAX_DIGEST_RUNS = 200;
    static final Duration DEFAULT_DIGEST_LOOKBACK = Duration.ofHours(24);

    private final OutboundMessageStore store;
    private final TransportSender sender;
    private final NotificationPolicyStore policyStore;
    private final RetryPolicy retryPolicy;
    private final JobStore runHistory;

    private final AtomicBoolean draining = new AtomicBoolean(false);

    public OutboundQueueProcessor(OutboundMessageStore store,
                                  TransportSender sender,
                                  NotificationPolicyStore policyStore,
                                  RetryPolicy retryPolicy) {
        this(store, sender, policyStore, retryPolicy, null);
    }

    /**
     * @param runHistory source of the quiet-period digest; null disables the digest
     */
    public OutboundQueueProcessor(OutboundMessageStore store,
                                  TransportSender sender,
                                  NotificationPolicyStore policyStore,
                                  RetryPolicy retryPolicy,
                                  JobStore runHistory) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.policyStore = Objects.requireNonNull(policyStore, "policyStore must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.runHistory = runHistory;
    }

    /**
     * Processes every message due at {@code now}. Returns immediately when a drain is already running.
     */
    public DrainSummary drainDueMessages(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (!draining.compareAndSet(false, true)) {
            log.debug("outbound drain already in progress, skipping");
            return DrainSummary.skippedDrain();
        }

        try {
            List<OutboundMessage> due = store.listDue(now);
            if (due.isEmpty()) {
                return new DrainSummary(0, 0, 0, 0, false);
            }

            NotificationPolicy policy = policyStore.get().orElse(null);
            Set<String> digested = sendQuietPeriodDigests(due, policy, now);
            int sent = digested.size();
            int retried = 0;
            int failed = 0;
            int suppressed = 0;

            for (OutboundMessage message : due) {
                if (digested.contains(message.id())) {
                    continue;
                }
                switch (processMessage(message, policy, now)) {
                    case SENT -> sent++;
                    case RETRIED -> retried++;
                    case FAILED -> failed++;
                    case SUPPRESSED -> suppressed++;
                }
            }

            log.debug("outbound drain finished due={} sent={} retried={} failed={} suppressed={}",
                    due.size(), sent, retried, failed, suppressed);
            return new DrainSummary(sent, retried, failed, suppressed, false);
        } finally {
            draining.set(false);
        }
    }

    /**
     * Replaces released held messages with one digest of the runs since the last digest, per chat.
     * A chat whose digest cannot be sent keeps its messages for normal processing.
     *
     * @return ids of the messages the digests replaced
     */
    private Set<String> sendQuietPeriodDigests(List<OutboundMessage> due, NotificationPolicy policy, Instant now) {
        if (runHistory == null) {
            return Set.of();
        }
        Map<Long, List<OutboundMessage>> releasedByChat = new LinkedHashMap<>();
        for (OutboundMessage message : due) {
            if (message.errorMessage() != null && message.errorMessage().startsWith(SUPPRESSED_PREFIX)) {
                releasedByChat.computeIfAbsent(message.chatId(), chatId -> new ArrayList<>()).add(message);
            }
        }
        if (releasedByChat.isEmpty() || NotificationGate.evaluate(policy, MessagePriority.NORMAL, now).isHold()) {
            return Set.of();
        }

        Instant since = policy != null && policy.lastDigestAt() != null
                ? policy.lastDigestAt()
                : now.minus(DEFAULT_DIGEST_LOOKBACK);
        List<RunSummary> runs = runHistory.listRecentRuns(since, MAX_DIGEST_RUNS).stream()
                .filter(run -> !HeartbeatTasks.HEARTBEAT_TASK_TYPE.equals(run.jobType()))
                .collect(Collectors.toList());
        String digest = QuietPeriodDigest.summarize(runs);

        Set<String> digested = new HashSet<>();
        for (Map.Entry<Long, List<OutboundMessage>> entry : releasedByChat.entrySet()) {
            try {
                for (String chunk : MessageSplitter.split(digest)) {
                    sender.sendMessage(entry.getKey(), chunk);
                }
            } catch (Exception e) {
                log.warn("quiet period digest delivery failed chatId={} msg={}", entry.getKey(), normalizeErrorMessage(e));
                continue;
            }
            for (OutboundMessage message : entry.getValue()) {
                store.markSent(message.id(), message.attemptCount() + 1, now);
                digested.add(message.id());
            }
            log.info("quiet period digest delivered chatId={} replacedMessages={} runs={}",
                    entry.getKey(), entry.getValue().size(), runs.size());
        }

        if (!digested.isEmpty()) {
            policyStore.setLastDigestAt(now, now);
        }
        return digested;
    }

    private Outcome processMessage(OutboundMessage message, NotificationPolicy policy, Instant now) {
        int nextAttempt = message.attemptCount() + 1;

        GateDecision decision = NotificationGate.evaluate(policy, message.priority(), now);
        if (decision.isHold()) {
            Instant retryAt = now.plus(retryPolicy.delay(nextAttempt));
            store.markRetry(message.id(), nextAttempt, retryAt, SUPPRESSED_PREFIX + decision.reason(), now);
            log.info("outbound message suppressed by notification policy id={} chatId={} reason={} retryAt={}",
                    message.id(), message.chatId(), decision.reason(), retryAt);
            return Outcome.SUPPRESSED;
        }

        try {
            deliver(message);
        } catch (Exception e) {
            return recordFailure(message, nextAttempt, e, now);
        }

        store.markSent(message.id(), nextAttempt, now);
        log.info("outbound message delivered id={} chatId={} kind={} attempt={}",
                message.id(), message.chatId(), message.kind(), nextAttempt);
        return Outcome.SENT;
    }

    private void deliver(OutboundMessage message) throws Exception {
        switch (message.kind()) {
            case TEXT -> {
                for (String chunk : MessageSplitter.split(message.content())) {
                    sender.sendMessage(message.chatId(), chunk);
                }
            }
            case DOCUMENT -> sender.sendDocument(message.chatId(), toAttachment(message));
            case PHOTO -> sender.sendPhoto(message.chatId(), toAttachment(message));
        }
    }

    private static MediaAttachment toAttachment(OutboundMessage message) {
        if (message.mediaPath() == null || message.mediaPath().isBlank()) {
            throw new IllegalStateException("Outbound " + message.kind() + " message " + message.id() + " has no media path");
        }
        String caption = message.content() == null || message.content().isBlank() ? null : message.content();
        return new MediaAttachment(message.mediaPath(), message.mediaFilename(), message.mediaMimeType(), caption);
    }

    private Outcome recordFailure(OutboundMessage message, int nextAttempt, Exception error, Instant now) {
        String errorMessage = normalizeErrorMessage(error);

        if (!retryPolicy.hasAttemptsLeft(nextAttempt)) {
            store.markFailed(message.id(), nextAttempt, errorMessage, now);
            log.error("outbound message delivery permanently failed id={} chatId={} attempt={} maxAttempts={} msg={}",
                    message.id(), message.chatId(), nextAttempt, retryPolicy.maxAttempts(), errorMessage, error);
            return Outcome.FAILED;
        }

        long delayMs = retryPolicy.calculateRetryDelayMs(nextAttempt);
        Instant retryAt = now.plusMillis(delayMs);
        store.markRetry(message.id(), nextAttempt, retryAt, errorMessage, now);
        log.warn("outbound message delivery failed, retrying id={} chatId={} attempt={} retryAt={} msg={}",
                message.id(), message.chatId(), nextAttempt, retryAt, errorMessage);
        return Outcome.RETRIED;
    }

    static String normalizeErrorMessage(Throwable error) {
        String raw = error.getMessage();
        if (raw == null || raw.isBlank()) {
            raw = error.getClass().getSimpleName();
        }
        return raw.length() > MAX_ERROR_MESSAGE_LENGTH ? raw.substring(0, MAX_ERROR_MESSAGE_LENGTH) : raw;
    }

    private enum Outcome {
        SENT,
        RETRIED,
        FAILED,
        SUPPRESSED
    }
}
