package io.otto4j.outbound;

import io.otto4j.core.outbound.MessagePriority;

/**
 * Request to queue a chat text message. Content longer than the transport limit is split.
 *
 * @param dedupeKey optional idempotence key, at most 512 characters
 * @param priority  defaults to {@link MessagePriority#NORMAL}
 */
public record TextMessageRequest(
        long chatId,
        String content,
        String dedupeKey,
        MessagePriority priority
) {
    public static final int MAX_DEDUPE_KEY_LENGTH = 512;

    public TextMessageRequest {
        if (chatId <= 0) {
            throw new IllegalArgumentException("chatId must be a positive number");
        }
        if (content == null || content.trim().isEmpty()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        content = content.trim();
        dedupeKey = normalizeDedupeKey(dedupeKey);
        if (priority == null) {
            priority = MessagePriority.NORMAL;
        }
    }

    public static TextMessageRequest of(long chatId, String content) {
        return new TextMessageRequest(chatId, content, null, null);
    }

    static String normalizeDedupeKey(String dedupeKey) {
        if (dedupeKey == null) {
            return null;
        }
        String trimmed = dedupeKey.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("dedupeKey must not be blank");
        }
        if (trimmed.length() > MAX_DEDUPE_KEY_LENGTH) {
            throw new IllegalArgumentException("dedupeKey must be at most " + MAX_DEDUPE_KEY_LENGTH + " characters");
        }
        return trimmed;
    }
}
