package io.otto4j.outbound;

import io.otto4j.core.outbound.MessagePriority;
import io.otto4j.core.outbound.NotificationPolicy;
import io.otto4j.core.outbound.QuietMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Decides whether a message may be delivered now under the recipient's notification policy.
 *
 * <p>Order of checks: override priority, then mute window, then quiet hours.
 */
public final class NotificationGate {
    private static final Logger log = LoggerFactory.getLogger(NotificationGate.class);

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("H:mm");

    private NotificationGate() {
    }

    /**
     * @param policy current policy; null means nothing is ever held
     */
    public static GateDecision evaluate(NotificationPolicy policy, MessagePriority priority, Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        if (priority != null && priority.bypassesPolicy()) {
            return GateDecision.deliver(GateDecision.REASON_CRITICAL_BYPASS);
        }
        if (policy == null) {
            return GateDecision.deliver(GateDecision.REASON_ALLOWED);
        }
        if (policy.muteUntil() != null && policy.muteUntil().isAfter(now)) {
            return GateDecision.hold(GateDecision.REASON_MUTED, policy.muteUntil());
        }
        if (policy.quietMode() == QuietMode.CRITICAL_ONLY && isQuietHoursActive(policy, now)) {
            return GateDecision.hold(GateDecision.REASON_QUIET_HOURS, quietHoursReleaseAt(policy, now));
        }
        return GateDecision.deliver(GateDecision.REASON_ALLOWED);
    }

    /**
     * Quiet hours cover {@code [start, end)} in local wall-clock time. A window with start after end
     * wraps past midnight; equal bounds or an unparseable bound disable the window.
     */
    public static boolean isQuietHoursActive(NotificationPolicy policy, Instant now) {
        LocalTime start = parseClock(policy.quietHoursStart());
        LocalTime end = parseClock(policy.quietHoursEnd());
        if (start == null || end == null || start.equals(end)) {
            return false;
        }

        LocalTime current = ZonedDateTime.ofInstant(now, resolveZone(policy.timezone()))
                .toLocalTime()
                .withSecond(0)
                .withNano(0);

        if (start.isBefore(end)) {
            return !current.isBefore(start) && current.isBefore(end);
        }
        return !current.isBefore(start) || current.isBefore(end);
    }

    private static Instant quietHoursReleaseAt(NotificationPolicy policy, Instant now) {
        LocalTime end = parseClock(policy.quietHoursEnd());
        ZonedDateTime local = ZonedDateTime.ofInstant(now, resolveZone(policy.timezone()));
        ZonedDateTime candidate = local.with(end).withSecond(0).withNano(0);
        if (!candidate.isAfter(local)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }

    /**
     * @return the parsed {@code H:mm} clock value, or null when blank or unparseable
     */
    public static LocalTime parseClock(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim(), CLOCK);
        } catch (DateTimeParseException e) {
            log.warn("ignoring unparseable clock value={}", value);
            return null;
        }
    }

    /**
     * @return the named zone, or the system default when blank or unknown
     */
    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("unknown notification timezone={}, using system default", timezone);
            return ZoneId.systemDefault();
        }
    }
}
