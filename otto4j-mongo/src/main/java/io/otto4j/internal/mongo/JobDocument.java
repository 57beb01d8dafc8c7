package io.otto4j.internal.mongo;

import io.otto4j.core.JobStatus;
import io.otto4j.core.ScheduleType;
import io.otto4j.core.TerminalState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for persisted jobs.
 */
@Document(collection = "jobs")
public class JobDocument {

    @Id
    private String id;

    private String type;
    private JobStatus status;
    private ScheduleType scheduleType;
    private String profileId;
    private Instant runAt;
    private Integer cadenceMinutes;
    private String payload;
    private Instant lastRunAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private TerminalState terminalState;
    private String terminalReason;
    private String lockToken;
    private Instant lockExpiresAt;
    private Instant createdAt;
    private Instant updatedAt;

    public JobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public ScheduleType getScheduleType() {
        return scheduleType;
    }

    public void setScheduleType(ScheduleType scheduleType) {
        this.scheduleType = scheduleType;
    }

    public String getProfileId() {
        return profileId;
    }

    public void setProfileId(String profileId) {
        this.profileId = profileId;
    }

    public Instant getRunAt() {
        return runAt;
    }

    public void setRunAt(Instant runAt) {
        this.runAt = runAt;
    }

    public Integer getCadenceMinutes() {
        return cadenceMinutes;
    }

    public void setCadenceMinutes(Integer cadenceMinutes) {
        this.cadenceMinutes = cadenceMinutes;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public TerminalState getTerminalState() {
        return terminalState;
    }

    public void setTerminalState(TerminalState terminalState) {
        this.terminalState = terminalState;
    }

    public String getTerminalReason() {
        return terminalReason;
    }

    public void setTerminalReason(String terminalReason) {
        this.terminalReason = terminalReason;
    }

    public String getLockToken() {
        return lockToken;
    }

    public void setLockToken(String lockToken) {
        this.lockToken = lockToken;
    }

    public Instant getLockExpiresAt() {
        return lockExpiresAt;
    }

    public void setLockExpiresAt(Instant lockExpiresAt) {
        this.lockExpiresAt = lockExpiresAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
