package io.otto4j.core.outbound;

import java.time.Instant;

/**
 * Durable outbound delivery row.
 *
 * <p>{@code dedupeKey}, when present, is unique across the queue. Rows in a terminal
 * {@link OutboundStatus} are never mutated and {@code attemptCount} never decreases.
 */
public record OutboundMessage(
        String id,
        String dedupeKey,
        long chatId,
        MessageKind kind,
        String content,
        String mediaPath,
        String mediaMimeType,
        String mediaFilename,
        MessagePriority priority,
        OutboundStatus status,
        int attemptCount,
        Instant nextAttemptAt,
        Instant sentAt,
        Instant failedAt,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * A fresh queued row, due at {@code now}.
     */
    public static OutboundMessage queued(String id,
                                         String dedupeKey,
                                         long chatId,
                                         MessageKind kind,
                                         String content,
                                         String mediaPath,
                                         String mediaMimeType,
                                         String mediaFilename,
                                         MessagePriority priority,
                                         Instant now) {
        return new OutboundMessage(id, dedupeKey, chatId, kind, content, mediaPath, mediaMimeType,
                mediaFilename, priority, OutboundStatus.QUEUED, 0, now, null, null, null, now, now);
    }

    public static OutboundMessage queuedText(String id, String dedupeKey, long chatId, String content,
                                             MessagePriority priority, Instant now) {
        return queued(id, dedupeKey, chatId, MessageKind.TEXT, content, null, null, null, priority, now);
    }
}
