package io.otto4j.heartbeat;

/**
 * What one heartbeat tick did.
 *
 * @param emitted   a new message was queued
 * @param dedupeKey key of the queued message; null when nothing was queued
 */
public record HeartbeatReport(
        Reason reason,
        boolean emitted,
        String summary,
        String dedupeKey
) {
    public enum Reason {
        NO_CHAT_ID,
        ONBOARDING_NEEDED,
        OUTSIDE_CADENCE,
        SIGNAL_EMPTY,
        QUIET_OR_MUTED,
        DEDUPE,
        QUEUED
    }

    static HeartbeatReport skipped(Reason reason, String summary) {
        return new HeartbeatReport(reason, false, summary, null);
    }
}
