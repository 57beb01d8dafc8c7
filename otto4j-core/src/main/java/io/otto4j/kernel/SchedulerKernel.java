package io.otto4j.kernel;

import io.otto4j.core.Job;
import io.otto4j.execution.TaskExecutionEngine;
import io.otto4j.internal.PollingLoop;
import io.otto4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically claims due jobs and hands them to the execution engine.
 *
 * <p>Each tick claims one batch under a fresh lock token and waits for the whole batch before the next
 * tick. A tick never overlaps another. When the engine throws for a job, the job's lock is released so
 * it is retried on a later tick.
 */
public class SchedulerKernel {
    private static final Logger log = LoggerFactory.getLogger(SchedulerKernel.class);

    private final JobStore jobStore;
    private final TaskExecutionEngine engine;
    private final SchedulerSettings settings;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean tickRunning = new AtomicBoolean(false);

    private ExecutorService workerPool;
    private PollingLoop loop;

    public SchedulerKernel(JobStore jobStore, TaskExecutionEngine engine, SchedulerSettings settings, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts the tick loop. Idempotent; does nothing when the scheduler is disabled.
     */
    public void start() {
        if (!settings.enabled()) {
            log.info("scheduler kernel disabled, not starting");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("scheduler kernel starting tickInterval={} batchSize={} lockLease={} workerThreads={}",
                settings.tickInterval(), settings.batchSize(), settings.lockLease(), settings.workerThreads());

        workerPool = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
            Thread t = new Thread(r);
            t.setName("otto.workerPool");
            t.setDaemon(true);
            return t;
        });
        loop = new PollingLoop("otto.scheduler", settings.tickInterval(), this::runTick);
        loop.start();
    }

    /**
     * Stops ticking and waits up to one lease for running jobs. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("scheduler kernel stopping");

        if (loop != null) {
            loop.stop();
            loop = null;
        }
        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(settings.lockLease().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        log.info("scheduler kernel stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Claims and executes one batch of due jobs. Jobs run on the worker pool once the kernel has started,
     * inline otherwise.
     *
     * @return number of jobs claimed; 0 when another tick was still running
     */
    public int runTick() {
        if (!tickRunning.compareAndSet(false, true)) {
            log.debug("scheduler tick already running, skipping");
            return 0;
        }
        try {
            Instant now = clock.instant();
            String lockToken = UUID.randomUUID().toString();
            List<Job> claimed = jobStore.claimDue(now, settings.batchSize(), lockToken, settings.lockLease(), now);
            if (claimed.isEmpty()) {
                return 0;
            }

            log.info("scheduler kernel claimed due jobs count={} lockToken={}", claimed.size(), lockToken);
            execute(claimed);
            return claimed.size();
        } finally {
            tickRunning.set(false);
        }
    }

    private void execute(List<Job> claimed) {
        ExecutorService pool = workerPool;
        if (pool == null) {
            claimed.forEach(this::executeOne);
            return;
        }

        List<Future<?>> futures = new ArrayList<>(claimed.size());
        for (Job job : claimed) {
            futures.add(pool.submit(() -> executeOne(job)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                log.error("scheduler worker failed msg={}", e.getCause().getMessage(), e.getCause());
            }
        }
    }

    private void executeOne(Job job) {
        try {
            engine.executeClaimedJob(job);
        } catch (Exception e) {
            log.error("scheduled job execution failed jobId={} type={} msg={}", job.id(), job.type(), e.getMessage(), e);
            try {
                jobStore.releaseLock(job.id(), job.lockToken(), clock.instant());
            } catch (Exception releaseEx) {
                log.error("scheduled job lock release failed jobId={} msg={}", job.id(), releaseEx.getMessage(), releaseEx);
            }
        }
    }
}
