package io.otto4j.watchdog;

/**
 * Configuration of the system watchdog task.
 *
 * @param cadenceMinutes how often the watchdog task runs, 5..1440
 */
public record WatchdogSettings(
        int cadenceMinutes,
        int lookbackMinutes,
        int maxFailures,
        int threshold,
        Long chatId
) {
    public static final int DEFAULT_CADENCE_MINUTES = 30;

    public WatchdogSettings {
        WatchdogOptions.requireRange("cadenceMinutes", cadenceMinutes, 5, 24 * 60);
        WatchdogOptions.requireRange("lookbackMinutes", lookbackMinutes, 5, 24 * 60);
        WatchdogOptions.requireRange("maxFailures", maxFailures, 1, 200);
        WatchdogOptions.requireRange("threshold", threshold, 1, 50);
        if (chatId != null && chatId < 1) {
            chatId = null;
        }
    }

    public static WatchdogSettings defaults() {
        return new WatchdogSettings(DEFAULT_CADENCE_MINUTES, WatchdogOptions.DEFAULT_LOOKBACK_MINUTES,
                WatchdogOptions.DEFAULT_MAX_FAILURES, WatchdogOptions.DEFAULT_THRESHOLD, null);
    }
}
