package io.otto4j.schedule;

import io.otto4j.core.TerminalState;

import java.time.Instant;

/**
 * What happens to a job's schedule after one of its runs completes.
 */
public interface ScheduleTransition {

    Instant lastRunAt();

    /**
     * Keep the job alive and move {@code nextRunAt} forward.
     */
    record Reschedule(Instant lastRunAt, Instant nextRunAt) implements ScheduleTransition {
    }

    /**
     * Make the job terminal; {@code nextRunAt} becomes null.
     */
    record Finalize(TerminalState terminalState, String terminalReason, Instant lastRunAt) implements ScheduleTransition {
    }
}
