package io.otto4j.internal.mongo;

import io.otto4j.config.OttoMongoIndexConfig;
import io.otto4j.core.outbound.OutboundMessage;
import io.otto4j.core.outbound.OutboundStatus;
import io.otto4j.spi.EnqueueOutcome;
import io.otto4j.spi.OutboundMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * MongoDB persistence for the outbound queue ({@code messages_out}).
 *
 * <p>Dedupe relies on the unique partial index on {@code dedupeKey}; it is created before the first
 * insert through this store.
 */
public class MongoOutboundMessageStore implements OutboundMessageStore {
    private static final Logger log = LoggerFactory.getLogger(MongoOutboundMessageStore.class);

    private final MongoTemplate mongoTemplate;
    private final AtomicBoolean dedupeIndexEnsured = new AtomicBoolean(false);

    public MongoOutboundMessageStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public EnqueueOutcome enqueueOrIgnoreDedupe(OutboundMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        ensureDedupeIndex();
        try {
            mongoTemplate.insert(toDocument(message));
            return EnqueueOutcome.enqueued(message.id());
        } catch (DuplicateKeyException e) {
            log.debug("outbound message deduplicated dedupeKey={}", message.dedupeKey());
            return EnqueueOutcome.duplicateResult();
        }
    }

    @Override
    public List<OutboundMessage> listDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(Criteria.where("status").is(OutboundStatus.QUEUED)
                .orOperator(
                        Criteria.where("nextAttemptAt").is(null),
                        Criteria.where("nextAttemptAt").lte(now)
                ))
                .with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        return mongoTemplate.find(q, OutboundMessageDocument.class).stream()
                .map(MongoOutboundMessageStore::toMessage)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<OutboundMessage> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, OutboundMessageDocument.class))
                .map(MongoOutboundMessageStore::toMessage);
    }

    @Override
    public boolean markSent(String id, int attemptCount, Instant sentAt) {
        Update u = new Update()
                .set("status", OutboundStatus.SENT)
                .set("attemptCount", attemptCount)
                .set("sentAt", sentAt)
                .unset("nextAttemptAt")
                .unset("errorMessage")
                .set("updatedAt", sentAt);
        return updateQueued(id, u);
    }

    @Override
    public boolean markRetry(String id, int attemptCount, Instant nextAttemptAt, String errorMessage, Instant updatedAt) {
        Update u = new Update()
                .set("attemptCount", attemptCount)
                .set("nextAttemptAt", nextAttemptAt)
                .set("errorMessage", errorMessage)
                .set("updatedAt", updatedAt);
        return updateQueued(id, u);
    }

    @Override
    public boolean markFailed(String id, int attemptCount, String errorMessage, Instant failedAt) {
        Update u = new Update()
                .set("status", OutboundStatus.FAILED)
                .set("attemptCount", attemptCount)
                .set("failedAt", failedAt)
                .unset("nextAttemptAt")
                .set("errorMessage", errorMessage)
                .set("updatedAt", failedAt);
        return updateQueued(id, u);
    }

    @Override
    public boolean cancel(String id, Instant updatedAt) {
        Update u = new Update()
                .set("status", OutboundStatus.CANCELLED)
                .unset("nextAttemptAt")
                .set("updatedAt", updatedAt);
        return updateQueued(id, u);
    }

    private boolean updateQueued(String id, Update update) {
        Objects.requireNonNull(id, "id must not be null");
        // terminal rows are never mutated
        Query q = new Query(Criteria.where("_id").is(id).and("status").is(OutboundStatus.QUEUED));
        return mongoTemplate.updateFirst(q, update, OutboundMessageDocument.class).getMatchedCount() > 0;
    }

    private void ensureDedupeIndex() {
        if (dedupeIndexEnsured.get()) {
            return;
        }
        mongoTemplate.indexOps(OutboundMessageDocument.class).createIndex(OttoMongoIndexConfig.dedupeKeyUniqueIndex());
        dedupeIndexEnsured.set(true);
    }

    private static OutboundMessageDocument toDocument(OutboundMessage message) {
        OutboundMessageDocument doc = new OutboundMessageDocument();
        doc.setId(message.id());
        doc.setDedupeKey(message.dedupeKey());
        doc.setChatId(message.chatId());
        doc.setKind(message.kind());
        doc.setContent(message.content());
        doc.setMediaPath(message.mediaPath());
        doc.setMediaMimeType(message.mediaMimeType());
        doc.setMediaFilename(message.mediaFilename());
        doc.setPriority(message.priority());
        doc.setStatus(message.status());
        doc.setAttemptCount(message.attemptCount());
        doc.setNextAttemptAt(message.nextAttemptAt());
        doc.setSentAt(message.sentAt());
        doc.setFailedAt(message.failedAt());
        doc.setErrorMessage(message.errorMessage());
        doc.setCreatedAt(message.createdAt());
        doc.setUpdatedAt(message.updatedAt());
        return doc;
    }

    private static OutboundMessage toMessage(OutboundMessageDocument doc) {
        return new OutboundMessage(
                doc.getId(),
                doc.getDedupeKey(),
                doc.getChatId(),
                doc.getKind(),
                doc.getContent(),
                doc.getMediaPath(),
                doc.getMediaMimeType(),
                doc.getMediaFilename(),
                doc.getPriority(),
                doc.getStatus(),
                doc.getAttemptCount(),
                doc.getNextAttemptAt(),
                doc.getSentAt(),
                doc.getFailedAt(),
                doc.getErrorMessage(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
