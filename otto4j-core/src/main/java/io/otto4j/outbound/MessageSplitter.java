package io.otto4j.outbound;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits message text into transport-sized chunks, preserving order.
 */
public final class MessageSplitter {

    /**
     * Maximum characters per chat message accepted by the transport.
     */
    public static final int MESSAGE_LIMIT = 4096;

    private MessageSplitter() {
    }

    public static List<String> split(String content) {
        return split(content, MESSAGE_LIMIT);
    }

    public static List<String> split(String content, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (content == null) {
            return List.of();
        }
        if (content.length() <= limit) {
            return List.of(content);
        }

        List<String> chunks = new ArrayList<>(content.length() / limit + 1);
        for (int offset = 0; offset < content.length(); offset += limit) {
            chunks.add(content.substring(offset, Math.min(offset + limit, content.length())));
        }
        return chunks;
    }

    /**
     * @param index 1-based chunk index
     * @return {@code <key>:<index>/<total>}, or null when there is no dedupe key
     */
    public static String chunkDedupeKey(String dedupeKey, int index, int total) {
        if (dedupeKey == null) {
            return null;
        }
        return dedupeKey + ":" + index + "/" + total;
    }
}
