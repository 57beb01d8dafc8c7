package io.otto4j;

import io.otto4j.core.Job;
import io.otto4j.core.JobRun;
import io.otto4j.core.PersistResult;

import java.util.List;
import java.util.Optional;

/**
 * Main runtime API: lifecycle of the scheduler and outbound loops plus task management.
 *
 * <p>Typical usage:
 * <pre>{@code
 * otto.start();
 *
 * otto.task("daily-digest")
 *     .profile("email-check")
 *     .payload(Map.of("mailbox", "inbox"))
 *     .every(24 * 60)
 *     .save();
 *
 * otto.now("ping-team", Map.of("message", "Ping team"));
 * otto.stop();
 * }</pre>
 */
public interface OttoScheduler {

    void start();

    void stop();

    /**
     * Create a task builder. Nothing is persisted until {@code save()} is called.
     */
    TaskBuilder task(String type);

    /**
     * Create and persist a oneshot task due immediately.
     */
    PersistResult now(String type, Object payload);

    Optional<Job> find(String jobId);

    List<Job> listJobs();

    /**
     * @return the most recent runs of a job, newest first
     */
    List<JobRun> runs(String jobId, int limit);

    /**
     * Cancel a task so it never runs again. Returns false if it was already terminal or does not exist.
     */
    boolean cancel(String jobId, String reason);

    boolean pause(String jobId);

    boolean resume(String jobId);
}
