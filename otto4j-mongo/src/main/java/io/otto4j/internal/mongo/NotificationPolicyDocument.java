package io.otto4j.internal.mongo;

import io.otto4j.core.outbound.QuietMode;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Single stored notification policy, id {@code default}.
 */
@Document(collection = "notification_policy")
public class NotificationPolicyDocument {

    @Id
    private String id;

    private String timezone;
    private String quietHoursStart;
    private String quietHoursEnd;
    private QuietMode quietMode;
    private Instant muteUntil;
    private String heartbeatMorning;
    private String heartbeatMidday;
    private String heartbeatEvening;
    private Integer heartbeatCadenceMinutes;
    private Boolean heartbeatOnlyIfSignal;
    private Instant onboardingCompletedAt;
    private Instant lastDigestAt;
    private Instant updatedAt;

    public NotificationPolicyDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getQuietHoursStart() {
        return quietHoursStart;
    }

    public void setQuietHoursStart(String quietHoursStart) {
        this.quietHoursStart = quietHoursStart;
    }

    public String getQuietHoursEnd() {
        return quietHoursEnd;
    }

    public void setQuietHoursEnd(String quietHoursEnd) {
        this.quietHoursEnd = quietHoursEnd;
    }

    public QuietMode getQuietMode() {
        return quietMode;
    }

    public void setQuietMode(QuietMode quietMode) {
        this.quietMode = quietMode;
    }

    public Instant getMuteUntil() {
        return muteUntil;
    }

    public void setMuteUntil(Instant muteUntil) {
        this.muteUntil = muteUntil;
    }

    public String getHeartbeatMorning() {
        return heartbeatMorning;
    }

    public void setHeartbeatMorning(String heartbeatMorning) {
        this.heartbeatMorning = heartbeatMorning;
    }

    public String getHeartbeatMidday() {
        return heartbeatMidday;
    }

    public void setHeartbeatMidday(String heartbeatMidday) {
        this.heartbeatMidday = heartbeatMidday;
    }

    public String getHeartbeatEvening() {
        return heartbeatEvening;
    }

    public void setHeartbeatEvening(String heartbeatEvening) {
        this.heartbeatEvening = heartbeatEvening;
    }

    public Integer getHeartbeatCadenceMinutes() {
        return heartbeatCadenceMinutes;
    }

    public void setHeartbeatCadenceMinutes(Integer heartbeatCadenceMinutes) {
        this.heartbeatCadenceMinutes = heartbeatCadenceMinutes;
    }

    public Boolean getHeartbeatOnlyIfSignal() {
        return heartbeatOnlyIfSignal;
    }

    public void setHeartbeatOnlyIfSignal(Boolean heartbeatOnlyIfSignal) {
        this.heartbeatOnlyIfSignal = heartbeatOnlyIfSignal;
    }

    public Instant getOnboardingCompletedAt() {
        return onboardingCompletedAt;
    }

    public void setOnboardingCompletedAt(Instant onboardingCompletedAt) {
        this.onboardingCompletedAt = onboardingCompletedAt;
    }

    public Instant getLastDigestAt() {
        return lastDigestAt;
    }

    public void setLastDigestAt(Instant lastDigestAt) {
        this.lastDigestAt = lastDigestAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
