package io.otto4j.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.otto4j.TaskBuilder;
import io.otto4j.core.Job;
import io.otto4j.core.JobStatus;
import io.otto4j.core.PersistResult;
import io.otto4j.core.ScheduleType;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Default {@link TaskBuilder} implementation.
 */
public class SimpleTaskBuilder implements TaskBuilder {

    private final String type;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Function<Job, PersistResult> persister;

    private String id;
    private String profileId;
    private String payload;
    private Instant runAt;
    private Integer cadenceMinutes;

    public SimpleTaskBuilder(String type, ObjectMapper objectMapper, Clock clock, Function<Job, PersistResult> persister) {
        Objects.requireNonNull(type, "task type must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("task type must not be blank");
        }
        this.type = type;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public TaskBuilder id(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        this.id = id;
        return this;
    }

    @Override
    public TaskBuilder profile(String profileId) {
        this.profileId = profileId == null || profileId.isBlank() ? null : profileId.trim();
        return this;
    }

    @Override
    public TaskBuilder payload(Object payload) {
        if (payload == null) {
            this.payload = null;
            return this;
        }
        try {
            this.payload = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload is not serializable to JSON", e);
        }
        return this;
    }

    @Override
    public TaskBuilder runAt(Instant time) {
        this.runAt = Objects.requireNonNull(time, "time must not be null");
        return this;
    }

    @Override
    public TaskBuilder now() {
        this.runAt = clock.instant();
        return this;
    }

    @Override
    public TaskBuilder every(int cadenceMinutes) {
        if (cadenceMinutes < 1) {
            throw new IllegalArgumentException("cadenceMinutes must be at least 1");
        }
        this.cadenceMinutes = cadenceMinutes;
        return this;
    }

    @Override
    public Job build() {
        Instant now = clock.instant();
        Instant firstRun = runAt != null ? runAt : now;
        if (cadenceMinutes == null && runAt == null) {
            throw new IllegalStateException("a oneshot task needs runAt(...) or now()");
        }

        return Job.builder()
                .id(id != null ? id : UUID.randomUUID().toString())
                .type(type)
                .status(JobStatus.IDLE)
                .scheduleType(cadenceMinutes != null ? ScheduleType.RECURRING : ScheduleType.ONESHOT)
                .profileId(profileId)
                .runAt(firstRun)
                .cadenceMinutes(cadenceMinutes)
                .payload(payload)
                .nextRunAt(firstRun)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Override
    public PersistResult save() {
        return persister.apply(build());
    }
}
