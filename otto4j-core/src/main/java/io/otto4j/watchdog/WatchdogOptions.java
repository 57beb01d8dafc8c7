package io.otto4j.watchdog;

import java.util.Set;

/**
 * Input of a single failure check.
 *
 * @param lookbackMinutes  window of failed runs to inspect, 5..1440
 * @param maxFailures      maximum failed runs read from the store, 1..200
 * @param threshold        failures needed to alert, 1..50
 * @param notifyRequested  whether an alert should be queued when the threshold is reached
 * @param chatId           alert recipient; falls back to the watchdog's default chat id when null
 * @param excludeTaskTypes job types whose failures are ignored
 */
public record WatchdogOptions(
        int lookbackMinutes,
        int maxFailures,
        int threshold,
        boolean notifyRequested,
        Long chatId,
        Set<String> excludeTaskTypes
) {
    public static final int DEFAULT_LOOKBACK_MINUTES = 120;
    public static final int DEFAULT_MAX_FAILURES = 20;
    public static final int DEFAULT_THRESHOLD = 2;

    public WatchdogOptions {
        requireRange("lookbackMinutes", lookbackMinutes, 5, 24 * 60);
        requireRange("maxFailures", maxFailures, 1, 200);
        requireRange("threshold", threshold, 1, 50);
        if (chatId != null && chatId < 1) {
            throw new IllegalArgumentException("chatId must be a positive number");
        }
        excludeTaskTypes = excludeTaskTypes == null ? Set.of() : Set.copyOf(excludeTaskTypes);
    }

    public static WatchdogOptions defaults() {
        return new WatchdogOptions(DEFAULT_LOOKBACK_MINUTES, DEFAULT_MAX_FAILURES, DEFAULT_THRESHOLD,
                false, null, Set.of());
    }

    public WatchdogOptions excluding(Set<String> taskTypes) {
        return new WatchdogOptions(lookbackMinutes, maxFailures, threshold, notifyRequested, chatId, taskTypes);
    }

    static void requireRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max + ", got " + value);
        }
    }
}
