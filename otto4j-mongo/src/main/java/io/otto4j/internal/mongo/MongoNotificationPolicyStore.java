package io.otto4j.internal.mongo;

import io.otto4j.core.outbound.NotificationPolicy;
import io.otto4j.spi.NotificationPolicyStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The single stored notification policy (document id {@value #POLICY_ID}).
 */
public class MongoNotificationPolicyStore implements NotificationPolicyStore {

    public static final String POLICY_ID = "default";

    private final MongoTemplate mongoTemplate;

    public MongoNotificationPolicyStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<NotificationPolicy> get() {
        NotificationPolicyDocument doc = mongoTemplate.findById(POLICY_ID, NotificationPolicyDocument.class);
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new NotificationPolicy(
                doc.getTimezone(),
                doc.getQuietHoursStart(),
                doc.getQuietHoursEnd(),
                doc.getQuietMode(),
                doc.getMuteUntil(),
                doc.getHeartbeatMorning(),
                doc.getHeartbeatMidday(),
                doc.getHeartbeatEvening(),
                doc.getHeartbeatCadenceMinutes(),
                doc.getHeartbeatOnlyIfSignal(),
                doc.getOnboardingCompletedAt(),
                doc.getLastDigestAt(),
                doc.getUpdatedAt()
        ));
    }

    @Override
    public void setLastDigestAt(Instant lastDigestAt, Instant updatedAt) {
        Objects.requireNonNull(lastDigestAt, "lastDigestAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        mongoTemplate.upsert(
                new Query(Criteria.where("_id").is(POLICY_ID)),
                new Update().set("lastDigestAt", lastDigestAt).set("updatedAt", updatedAt),
                NotificationPolicyDocument.class
        );
    }
}
