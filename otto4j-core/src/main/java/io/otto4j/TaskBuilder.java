package io.otto4j;

import io.otto4j.core.Job;
import io.otto4j.core.PersistResult;

import java.time.Instant;

/**
 * Fluent builder for configuring a task before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job</li>
 *   <li>save(): build() + insert into the job store</li>
 * </ul>
 */
public interface TaskBuilder {

    /**
     * Use a fixed id instead of a generated one. Saving an id that already exists is a no-op.
     */
    TaskBuilder id(String id);

    /**
     * Select the task profile overlay used when building the execution config.
     */
    TaskBuilder profile(String profileId);

    /**
     * Payload object, serialized to JSON.
     */
    TaskBuilder payload(Object payload);

    /**
     * Run once at the given time.
     */
    TaskBuilder runAt(Instant time);

    /**
     * Run once, as soon as possible.
     */
    TaskBuilder now();

    /**
     * Repeat every {@code cadenceMinutes}, first run at {@link #runAt(Instant)} if set, otherwise now.
     */
    TaskBuilder every(int cadenceMinutes);

    Job build();

    PersistResult save();
}
