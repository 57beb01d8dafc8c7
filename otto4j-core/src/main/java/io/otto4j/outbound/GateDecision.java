package io.otto4j.outbound;

import java.time.Instant;

/**
 * @param releaseAt when a held message would next be allowed; null when delivering now
 */
public record GateDecision(
        Action action,
        String reason,
        Instant releaseAt
) {
    public static final String REASON_ALLOWED = "allowed";
    public static final String REASON_CRITICAL_BYPASS = "critical_bypass";
    public static final String REASON_MUTED = "muted";
    public static final String REASON_QUIET_HOURS = "quiet_hours";

    public enum Action {
        DELIVER_NOW,
        HOLD
    }

    public static GateDecision deliver(String reason) {
        return new GateDecision(Action.DELIVER_NOW, reason, null);
    }

    public static GateDecision hold(String reason, Instant releaseAt) {
        return new GateDecision(Action.HOLD, reason, releaseAt);
    }

    public boolean isHold() {
        return action == Action.HOLD;
    }
}
