package io.otto4j.schedule;

import io.otto4j.core.Job;
import io.otto4j.core.TerminalState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Computes the post-run schedule transition of a job.
 *
 * <p>The outcome of the run is deliberately not an input: a oneshot job is completed whether its
 * run succeeded or failed, and a recurring job always advances by its cadence.
 */
public final class ScheduleTransitionResolver {

    private ScheduleTransitionResolver() {
    }

    /**
     * @throws InvalidScheduleException when a recurring job has no cadence or a cadence below one minute
     */
    public static ScheduleTransition resolve(Job job, Instant completedAt) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
        Objects.requireNonNull(job.scheduleType(), "job.scheduleType must not be null");

        return switch (job.scheduleType()) {
            case ONESHOT -> new ScheduleTransition.Finalize(TerminalState.COMPLETED, null, completedAt);
            case RECURRING -> {
                Integer cadence = job.cadenceMinutes();
                if (cadence == null || cadence < 1) {
                    throw new InvalidScheduleException(
                            "Recurring job " + job.id() + " has invalid cadenceMinutes: " + cadence);
                }
                yield new ScheduleTransition.Reschedule(completedAt, completedAt.plus(Duration.ofMinutes(cadence)));
            }
        };
    }
}
