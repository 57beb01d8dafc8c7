package io.otto4j.spi;

import io.otto4j.core.outbound.OutboundMessage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the outbound delivery queue.
 *
 * <p>The {@code mark*} transitions only apply to rows that are still {@code QUEUED}.
 */
public interface OutboundMessageStore {

    /**
     * Inserts the message. A uniqueness violation on {@code dedupeKey} is reported as a duplicate
     * outcome instead of an error.
     */
    EnqueueOutcome enqueueOrIgnoreDedupe(OutboundMessage message);

    /**
     * @return queued rows with {@code nextAttemptAt} null or not after {@code now}, oldest first
     */
    List<OutboundMessage> listDue(Instant now);

    Optional<OutboundMessage> findById(String id);

    boolean markSent(String id, int attemptCount, Instant sentAt);

    boolean markRetry(String id, int attemptCount, Instant nextAttemptAt, String errorMessage, Instant updatedAt);

    boolean markFailed(String id, int attemptCount, String errorMessage, Instant failedAt);

    /**
     * Moves a queued row to {@code CANCELLED}. Not used by the drain itself.
     */
    boolean cancel(String id, Instant updatedAt);
}
