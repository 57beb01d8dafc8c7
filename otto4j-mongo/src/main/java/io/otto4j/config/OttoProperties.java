package io.otto4j.config;

import io.otto4j.heartbeat.HeartbeatTasks;
import io.otto4j.kernel.SchedulerSettings;
import io.otto4j.outbound.RetryPolicy;
import io.otto4j.watchdog.WatchdogOptions;
import io.otto4j.watchdog.WatchdogSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Runtime configuration for the otto scheduler, outbound queue, watchdog and heartbeat.
 */
@ConfigurationProperties(prefix = "otto")
public class OttoProperties {
    private boolean enabled = true;
    private String home = Paths.get(System.getProperty("user.home"), ".otto").toString(); // task-config root
    private boolean ensureIndexesOnStartup = false;

    private final Scheduler scheduler = new Scheduler();
    private final Outbound outbound = new Outbound();
    private final Watchdog watchdog = new Watchdog();
    private final Heartbeat heartbeat = new Heartbeat();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHome() {
        return home;
    }

    public void setHome(String home) {
        this.home = home;
    }

    public Path homePath() {
        return Paths.get(home);
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Outbound getOutbound() {
        return outbound;
    }

    public Watchdog getWatchdog() {
        return watchdog;
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    /**
     * Heartbeat recipient, falling back to the watchdog's default chat.
     */
    public Long heartbeatChatId() {
        return heartbeat.getDefaultChatId() != null ? heartbeat.getDefaultChatId() : watchdog.getDefaultChatId();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration tickInterval = SchedulerSettings.DEFAULT_TICK_INTERVAL;
        private int batchSize = SchedulerSettings.DEFAULT_BATCH_SIZE;
        private Duration lockLease = SchedulerSettings.DEFAULT_LOCK_LEASE;
        private int workerThreads = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getLockLease() {
            return lockLease;
        }

        public void setLockLease(Duration lockLease) {
            this.lockLease = lockLease;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public SchedulerSettings toSettings() {
            return new SchedulerSettings(enabled, tickInterval, batchSize, lockLease, workerThreads);
        }
    }

    public static class Outbound {
        private boolean enabled = true;
        private Duration drainInterval = Duration.ofSeconds(2);
        private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        private Duration retryBaseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
        private Duration retryMaxDelay = RetryPolicy.DEFAULT_MAX_DELAY;
        private boolean quietPeriodDigest = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getDrainInterval() {
            return drainInterval;
        }

        public void setDrainInterval(Duration drainInterval) {
            this.drainInterval = drainInterval;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryBaseDelay() {
            return retryBaseDelay;
        }

        public void setRetryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
        }

        public Duration getRetryMaxDelay() {
            return retryMaxDelay;
        }

        public void setRetryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
        }

        public boolean isQuietPeriodDigest() {
            return quietPeriodDigest;
        }

        public void setQuietPeriodDigest(boolean quietPeriodDigest) {
            this.quietPeriodDigest = quietPeriodDigest;
        }

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(maxAttempts, retryBaseDelay, retryMaxDelay);
        }
    }

    public static class Watchdog {
        private boolean enabled = true;
        private int cadenceMinutes = WatchdogSettings.DEFAULT_CADENCE_MINUTES;
        private int lookbackMinutes = WatchdogOptions.DEFAULT_LOOKBACK_MINUTES;
        private int maxFailures = WatchdogOptions.DEFAULT_MAX_FAILURES;
        private int threshold = WatchdogOptions.DEFAULT_THRESHOLD;
        private Long defaultChatId;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCadenceMinutes() {
            return cadenceMinutes;
        }

        public void setCadenceMinutes(int cadenceMinutes) {
            this.cadenceMinutes = cadenceMinutes;
        }

        public int getLookbackMinutes() {
            return lookbackMinutes;
        }

        public void setLookbackMinutes(int lookbackMinutes) {
            this.lookbackMinutes = lookbackMinutes;
        }

        public int getMaxFailures() {
            return maxFailures;
        }

        public void setMaxFailures(int maxFailures) {
            this.maxFailures = maxFailures;
        }

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public Long getDefaultChatId() {
            return defaultChatId;
        }

        public void setDefaultChatId(Long defaultChatId) {
            this.defaultChatId = defaultChatId;
        }

        public WatchdogSettings toSettings() {
            return new WatchdogSettings(cadenceMinutes, lookbackMinutes, maxFailures, threshold, defaultChatId);
        }
    }

    public static class Heartbeat {
        private boolean enabled = false;
        private int cadenceMinutes = HeartbeatTasks.DEFAULT_CADENCE_MINUTES;
        private Long defaultChatId;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCadenceMinutes() {
            return cadenceMinutes;
        }

        public void setCadenceMinutes(int cadenceMinutes) {
            this.cadenceMinutes = cadenceMinutes;
        }

        public Long getDefaultChatId() {
            return defaultChatId;
        }

        public void setDefaultChatId(Long defaultChatId) {
            this.defaultChatId = defaultChatId;
        }
    }
}
