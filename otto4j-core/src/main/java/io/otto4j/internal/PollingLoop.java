package io.otto4j.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daemon thread that runs a task at a fixed interval.
 *
 * <p>A failing iteration is logged and retried with exponential backoff; after
 * {@value #MAX_CONSECUTIVE_FAILURES} consecutive failures the loop stops itself.
 * {@link #start()} and {@link #stop()} are idempotent.
 */
public final class PollingLoop {
    private static final Logger log = LoggerFactory.getLogger(PollingLoop.class);

    static final int MAX_CONSECUTIVE_FAILURES = 30;

    private final String name;
    private final Duration interval;
    private final Runnable iteration;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Thread thread;
    private int systemErrorCount = 0;

    public PollingLoop(String name, Duration interval, Runnable iteration) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.iteration = Objects.requireNonNull(iteration, "iteration must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException(name + " interval must be a positive duration");
        }
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        systemErrorCount = 0;
        Thread t = new Thread(this::loop);
        t.setName(name);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        Thread t = thread;
        thread = null;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }

    public boolean isRunning() {
        return started.get();
    }

    private void loop() {
        while (started.get()) {
            try {
                iteration.run();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("{} iteration failed count={} msg={}", name, systemErrorCount, e.getMessage(), e);
                if (systemErrorCount >= MAX_CONSECUTIVE_FAILURES) {
                    log.error("{} stopped after {} consecutive failures", name, systemErrorCount);
                    stop();
                    break;
                }
                if (!sleep(systemErrorCount >= 10 ? Duration.ofSeconds(60) : backoff(systemErrorCount))) {
                    break;
                }
                continue;
            }

            if (!started.get() || !sleep(interval)) {
                break;
            }
        }
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Exponential backoff for repeated iteration failures.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
