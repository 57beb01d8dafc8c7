package io.otto4j.outbound;

import io.otto4j.core.outbound.MessageKind;
import io.otto4j.core.outbound.MessagePriority;

/**
 * Request to queue a document or photo stored at {@code filePath}.
 *
 * @param caption optional, at most 4000 characters
 */
public record FileMessageRequest(
        long chatId,
        MessageKind kind,
        String filePath,
        String mimeType,
        String fileName,
        String caption,
        String dedupeKey,
        MessagePriority priority
) {
    public static final int MAX_CAPTION_LENGTH = 4000;

    public FileMessageRequest {
        if (chatId <= 0) {
            throw new IllegalArgumentException("chatId must be a positive number");
        }
        if (kind == null || !kind.hasMedia()) {
            throw new IllegalArgumentException("kind must be DOCUMENT or PHOTO");
        }
        filePath = requireText(filePath, "filePath");
        mimeType = requireText(mimeType, "mimeType");
        fileName = fileName == null || fileName.isBlank() ? null : fileName.trim();
        caption = caption == null ? null : caption.trim();
        if (caption != null && caption.length() > MAX_CAPTION_LENGTH) {
            throw new IllegalArgumentException("caption must be at most " + MAX_CAPTION_LENGTH + " characters");
        }
        dedupeKey = TextMessageRequest.normalizeDedupeKey(dedupeKey);
        if (priority == null) {
            priority = MessagePriority.NORMAL;
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
