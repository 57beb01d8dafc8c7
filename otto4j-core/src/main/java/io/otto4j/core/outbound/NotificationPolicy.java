package io.otto4j.core.outbound;

import java.time.Instant;

/**
 * Recipient delivery preferences. Quiet hours are local wall-clock {@code HH:mm} strings evaluated in
 * {@code timezone}; a window whose start is after its end wraps past midnight.
 *
 * @param heartbeatOnlyIfSignal null means true
 * @param lastDigestAt          when the last heartbeat or quiet-period digest went out
 */
public record NotificationPolicy(
        String timezone,
        String quietHoursStart,
        String quietHoursEnd,
        QuietMode quietMode,
        Instant muteUntil,
        String heartbeatMorning,
        String heartbeatMidday,
        String heartbeatEvening,
        Integer heartbeatCadenceMinutes,
        Boolean heartbeatOnlyIfSignal,
        Instant onboardingCompletedAt,
        Instant lastDigestAt,
        Instant updatedAt
) {

    public NotificationPolicy {
        if (quietMode == null) {
            quietMode = QuietMode.CRITICAL_ONLY;
        }
    }

    /**
     * Policy with only quiet hours set, everything else at defaults.
     */
    public static NotificationPolicy quietHours(String timezone, String start, String end) {
        return new NotificationPolicy(timezone, start, end, QuietMode.CRITICAL_ONLY, null,
                null, null, null, null, null, null, null, null);
    }

    public NotificationPolicy withMuteUntil(Instant muteUntil) {
        return new NotificationPolicy(timezone, quietHoursStart, quietHoursEnd, quietMode, muteUntil,
                heartbeatMorning, heartbeatMidday, heartbeatEvening, heartbeatCadenceMinutes,
                heartbeatOnlyIfSignal, onboardingCompletedAt, lastDigestAt, updatedAt);
    }

    public NotificationPolicy withLastDigestAt(Instant lastDigestAt) {
        return new NotificationPolicy(timezone, quietHoursStart, quietHoursEnd, quietMode, muteUntil,
                heartbeatMorning, heartbeatMidday, heartbeatEvening, heartbeatCadenceMinutes,
                heartbeatOnlyIfSignal, onboardingCompletedAt, lastDigestAt, updatedAt);
    }

    /**
     * Onboarding is complete once it was explicitly recorded, or once timezone and both quiet hour
     * bounds are set.
     */
    public boolean isOnboardingComplete() {
        if (onboardingCompletedAt != null) {
            return true;
        }
        return hasText(timezone) && hasText(quietHoursStart) && hasText(quietHoursEnd);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
