package io.otto4j.internal.mongo;

import io.otto4j.spi.SessionBindingStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public class MongoSessionBindingStore implements SessionBindingStore {

    private final MongoTemplate mongoTemplate;

    public MongoSessionBindingStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<String> findSessionId(String bindingKey) {
        Objects.requireNonNull(bindingKey, "bindingKey must not be null");
        return Optional.ofNullable(mongoTemplate.findById(bindingKey, SessionBindingDocument.class))
                .map(SessionBindingDocument::getSessionId)
                .filter(sessionId -> !sessionId.isBlank());
    }

    @Override
    public void upsert(String bindingKey, String sessionId, Instant updatedAt) {
        Objects.requireNonNull(bindingKey, "bindingKey must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        mongoTemplate.upsert(
                new Query(Criteria.where("_id").is(bindingKey)),
                new Update().set("sessionId", sessionId).set("updatedAt", updatedAt),
                SessionBindingDocument.class
        );
    }
}
