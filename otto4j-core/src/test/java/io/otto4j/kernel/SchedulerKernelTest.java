package io.otto4j.kernel;

import io.otto4j.core.Job;
import io.otto4j.core.JobStatus;
import io.otto4j.core.ScheduleType;
import io.otto4j.execution.TaskExecutionEngine;
import io.otto4j.support.InMemoryJobStore;
import io.otto4j.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchedulerKernelTest {

    private static final Instant NOW = Instant.parse("2026-01-10T08:00:00Z");
    private static final SchedulerSettings SETTINGS =
            new SchedulerSettings(true, Duration.ofSeconds(1), 10, Duration.ofSeconds(90), 2);

    @Mock
    private TaskExecutionEngine engine;

    private MutableClock clock;
    private InMemoryJobStore jobStore;
    private SchedulerKernel kernel;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        jobStore = new InMemoryJobStore();
        kernel = new SchedulerKernel(jobStore, engine, SETTINGS, clock);
    }

    @Test
    void tickClaimsDueJobsUnderOneLockToken() {
        jobStore.create(job("due-1", NOW.minusSeconds(5)));
        jobStore.create(job("due-2", NOW));
        jobStore.create(job("later", NOW.plusSeconds(60)));

        int claimed = kernel.runTick();

        assertThat(claimed).isEqualTo(2);
        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(engine, times(2)).executeClaimedJob(captor.capture());
        assertThat(captor.getAllValues()).extracting(Job::id).containsExactly("due-1", "due-2");
        assertThat(captor.getAllValues()).extracting(Job::lockToken).doesNotContainNull().containsOnly(captor.getValue().lockToken());
        assertThat(captor.getAllValues()).allSatisfy(job -> {
            assertThat(job.status()).isEqualTo(JobStatus.RUNNING);
            assertThat(job.lockExpiresAt()).isEqualTo(NOW.plusSeconds(90));
        });
    }

    @Test
    void lockedJobIsNotClaimedAgainUntilLeaseExpires() {
        jobStore.create(job("job-1", NOW));

        assertThat(kernel.runTick()).isEqualTo(1);
        clock.advance(Duration.ofSeconds(60));
        assertThat(kernel.runTick()).isZero();

        clock.advance(Duration.ofSeconds(31));
        assertThat(kernel.runTick()).isEqualTo(1);
        verify(engine, times(2)).executeClaimedJob(any());
    }

    @Test
    void engineFailureReleasesTheLock() {
        jobStore.create(job("job-1", NOW));
        when(engine.executeClaimedJob(any())).thenThrow(new IllegalStateException("store unavailable"));

        kernel.runTick();

        Job job = jobStore.get("job-1");
        assertThat(job.lockToken()).isNull();
        assertThat(job.status()).isEqualTo(JobStatus.IDLE);
        assertThat(job.nextRunAt()).isEqualTo(NOW);
        assertThat(kernel.runTick()).isEqualTo(1);
    }

    @Test
    void pausedAndTerminalJobsAreNeverClaimed() {
        jobStore.create(job("paused", NOW));
        jobStore.setPaused("paused", true, NOW);
        jobStore.create(job("cancelled", NOW));
        jobStore.cancel("cancelled", "not needed", NOW);

        assertThat(kernel.runTick()).isZero();
        verify(engine, never()).executeClaimedJob(any());
    }

    @Test
    void batchSizeLimitsOneTick() {
        SchedulerKernel small = new SchedulerKernel(jobStore, engine,
                new SchedulerSettings(true, Duration.ofSeconds(1), 1, Duration.ofSeconds(90), 1), clock);
        jobStore.create(job("a", NOW.minusSeconds(2)));
        jobStore.create(job("b", NOW.minusSeconds(1)));

        assertThat(small.runTick()).isEqualTo(1);
        assertThat(small.runTick()).isEqualTo(1);
        assertThat(small.runTick()).isZero();
    }

    @Test
    void startedKernelExecutesJobsOnWorkerPool() {
        jobStore.create(job("job-1", NOW));

        kernel.start();
        kernel.start();
        try {
            verify(engine, timeout(5_000)).executeClaimedJob(any());
            assertThat(kernel.isRunning()).isTrue();
        } finally {
            kernel.stop();
        }
        assertThat(kernel.isRunning()).isFalse();
    }

    @Test
    void disabledKernelDoesNotStart() {
        SchedulerKernel disabled = new SchedulerKernel(jobStore, engine,
                new SchedulerSettings(false, Duration.ofSeconds(1), 10, Duration.ofSeconds(90), 1), clock);

        disabled.start();

        assertThat(disabled.isRunning()).isFalse();
    }

    private static Job job(String id, Instant nextRunAt) {
        return Job.builder()
                .id(id)
                .type("reminder")
                .scheduleType(ScheduleType.ONESHOT)
                .runAt(nextRunAt)
                .nextRunAt(nextRunAt)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
