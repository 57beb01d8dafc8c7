package io.otto4j.core;

import java.time.Instant;

/**
 * Persistent scheduled unit of work.
 *
 * <p>Invariants maintained by the store:
 * <ul>
 *   <li>{@code status == RUNNING} only while a lock token is held</li>
 *   <li>a oneshot job has {@code nextRunAt == null} exactly when {@code terminalState} is set</li>
 *   <li>{@code terminalState} is written at most once</li>
 * </ul>
 *
 * @param payload opaque JSON text, interpreted per {@code type} by the execution engine
 */
public record Job(
        String id,
        String type,
        JobStatus status,
        ScheduleType scheduleType,
        String profileId,
        Instant runAt,
        Integer cadenceMinutes,
        String payload,
        Instant lastRunAt,
        Instant nextRunAt,
        TerminalState terminalState,
        String terminalReason,
        String lockToken,
        Instant lockExpiresAt,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isTerminal() {
        return terminalState != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .status(status)
                .scheduleType(scheduleType)
                .profileId(profileId)
                .runAt(runAt)
                .cadenceMinutes(cadenceMinutes)
                .payload(payload)
                .lastRunAt(lastRunAt)
                .nextRunAt(nextRunAt)
                .terminalState(terminalState)
                .terminalReason(terminalReason)
                .lockToken(lockToken)
                .lockExpiresAt(lockExpiresAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static final class Builder {
        private String id;
        private String type;
        private JobStatus status = JobStatus.IDLE;
        private ScheduleType scheduleType;
        private String profileId;
        private Instant runAt;
        private Integer cadenceMinutes;
        private String payload;
        private Instant lastRunAt;
        private Instant nextRunAt;
        private TerminalState terminalState;
        private String terminalReason;
        private String lockToken;
        private Instant lockExpiresAt;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder scheduleType(ScheduleType scheduleType) {
            this.scheduleType = scheduleType;
            return this;
        }

        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder runAt(Instant runAt) {
            this.runAt = runAt;
            return this;
        }

        public Builder cadenceMinutes(Integer cadenceMinutes) {
            this.cadenceMinutes = cadenceMinutes;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder terminalState(TerminalState terminalState) {
            this.terminalState = terminalState;
            return this;
        }

        public Builder terminalReason(String terminalReason) {
            this.terminalReason = terminalReason;
            return this;
        }

        public Builder lockToken(String lockToken) {
            this.lockToken = lockToken;
            return this;
        }

        public Builder lockExpiresAt(Instant lockExpiresAt) {
            this.lockExpiresAt = lockExpiresAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(id, type, status, scheduleType, profileId, runAt, cadenceMinutes, payload,
                    lastRunAt, nextRunAt, terminalState, terminalReason, lockToken, lockExpiresAt,
                    createdAt, updatedAt);
        }
    }
}
