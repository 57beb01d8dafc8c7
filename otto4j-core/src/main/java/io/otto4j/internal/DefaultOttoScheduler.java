package io.otto4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.otto4j.OttoScheduler;
import io.otto4j.TaskBuilder;
import io.otto4j.core.Job;
import io.otto4j.core.JobRun;
import io.otto4j.core.PersistResult;
import io.otto4j.kernel.SchedulerKernel;
import io.otto4j.outbound.OutboundQueueWorker;
import io.otto4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link OttoScheduler} over a {@link JobStore}, driving the scheduler kernel and, when present, the
 * outbound queue worker.
 */
public class DefaultOttoScheduler implements OttoScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultOttoScheduler.class);

    private final JobStore jobStore;
    private final SchedulerKernel kernel;
    private final OutboundQueueWorker outboundWorker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    /**
     * @param outboundWorker may be null when no transport is configured
     */
    public DefaultOttoScheduler(JobStore jobStore,
                                SchedulerKernel kernel,
                                OutboundQueueWorker outboundWorker,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
        this.outboundWorker = outboundWorker;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        kernel.start();
        if (outboundWorker != null) {
            outboundWorker.start();
        }
        log.info("otto scheduler started");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        kernel.stop();
        if (outboundWorker != null) {
            outboundWorker.stop();
        }
        log.info("otto scheduler stopped");
    }

    @Override
    public TaskBuilder task(String type) {
        return new SimpleTaskBuilder(type, objectMapper, clock, jobStore::create);
    }

    @Override
    public PersistResult now(String type, Object payload) {
        return task(type).payload(payload).now().save();
    }

    @Override
    public Optional<Job> find(String jobId) {
        return jobStore.findById(jobId);
    }

    @Override
    public List<Job> listJobs() {
        return jobStore.listJobs();
    }

    @Override
    public List<JobRun> runs(String jobId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return jobStore.listRunsByJobId(jobId, limit);
    }

    @Override
    public boolean cancel(String jobId, String reason) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        boolean cancelled = jobStore.cancel(jobId, reason, clock.instant());
        log.info("task cancel requested jobId={} cancelled={}", jobId, cancelled);
        return cancelled;
    }

    @Override
    public boolean pause(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return jobStore.setPaused(jobId, true, clock.instant());
    }

    @Override
    public boolean resume(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return jobStore.setPaused(jobId, false, clock.instant());
    }
}
