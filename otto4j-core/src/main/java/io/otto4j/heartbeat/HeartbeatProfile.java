package io.otto4j.heartbeat;

import io.otto4j.core.outbound.NotificationPolicy;
import io.otto4j.outbound.NotificationGate;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Heartbeat settings of a notification policy with defaults applied.
 *
 * @param cadenceMinutes summary cadence outside the daily windows, at least 30
 */
record HeartbeatProfile(
        ZoneId zone,
        LocalTime morning,
        LocalTime midday,
        LocalTime evening,
        int cadenceMinutes,
        boolean onlyIfSignal
) {
    static final LocalTime DEFAULT_MORNING = LocalTime.of(8, 30);
    static final LocalTime DEFAULT_MIDDAY = LocalTime.of(12, 30);
    static final LocalTime DEFAULT_EVENING = LocalTime.of(19, 0);
    static final int DEFAULT_CADENCE_MINUTES = 180;
    static final int MIN_CADENCE_MINUTES = 30;

    /**
     * @param policy stored policy; null yields every default
     */
    static HeartbeatProfile of(NotificationPolicy policy) {
        if (policy == null) {
            return new HeartbeatProfile(NotificationGate.resolveZone(null), DEFAULT_MORNING, DEFAULT_MIDDAY,
                    DEFAULT_EVENING, DEFAULT_CADENCE_MINUTES, true);
        }
        Integer cadence = policy.heartbeatCadenceMinutes();
        return new HeartbeatProfile(
                NotificationGate.resolveZone(policy.timezone()),
                clockOrDefault(policy.heartbeatMorning(), DEFAULT_MORNING),
                clockOrDefault(policy.heartbeatMidday(), DEFAULT_MIDDAY),
                clockOrDefault(policy.heartbeatEvening(), DEFAULT_EVENING),
                cadence != null && cadence >= MIN_CADENCE_MINUTES ? cadence : DEFAULT_CADENCE_MINUTES,
                policy.heartbeatOnlyIfSignal() == null || policy.heartbeatOnlyIfSignal()
        );
    }

    private static LocalTime clockOrDefault(String value, LocalTime defaultValue) {
        LocalTime parsed = NotificationGate.parseClock(value);
        return parsed != null ? parsed : defaultValue;
    }
}
