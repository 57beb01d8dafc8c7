package io.otto4j.outbound;

import java.util.List;

/**
 * Summary of an enqueue request that may have produced several chunk rows.
 *
 * @param status    {@code ENQUEUED} when at least one row was inserted
 * @param dedupeKey the caller's key before chunk suffixes were applied
 */
public record EnqueueResult(
        Status status,
        int queuedCount,
        int duplicateCount,
        List<String> messageIds,
        String dedupeKey
) {
    public enum Status {
        ENQUEUED,
        DUPLICATE
    }

    public EnqueueResult {
        messageIds = List.copyOf(messageIds);
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }
}
