package io.otto4j.watchdog;

import io.otto4j.core.FailedRun;

import java.util.List;

public record WatchdogReport(
        int lookbackMinutes,
        int maxFailures,
        int threshold,
        int failedCount,
        boolean shouldAlert,
        boolean notified,
        NotificationStatus notificationStatus,
        String dedupeKey,
        List<FailedRun> failures
) {
    public WatchdogReport {
        failures = List.copyOf(failures);
    }
}
