package io.otto4j.spi;

/**
 * Result of a single dedupe-aware insert into the outbound queue.
 *
 * @param messageId id of the inserted row; null for a duplicate
 */
public record EnqueueOutcome(
        boolean duplicate,
        String messageId
) {
    public static EnqueueOutcome enqueued(String messageId) {
        return new EnqueueOutcome(false, messageId);
    }

    public static EnqueueOutcome duplicateResult() {
        return new EnqueueOutcome(true, null);
    }
}
