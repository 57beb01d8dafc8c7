package io.otto4j.outbound;

import io.otto4j.core.outbound.OutboundMessage;
import io.otto4j.spi.EnqueueOutcome;
import io.otto4j.spi.OutboundMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns queue requests into durable outbound rows with deterministic per-chunk dedupe keys.
 */
public class OutboundEnqueuer {
    private static final Logger log = LoggerFactory.getLogger(OutboundEnqueuer.class);

    private final OutboundMessageStore store;

    public OutboundEnqueuer(OutboundMessageStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public EnqueueResult enqueueText(TextMessageRequest request, Instant now) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(now, "now must not be null");

        List<String> chunks = MessageSplitter.split(request.content());
        List<String> messageIds = new ArrayList<>(chunks.size());
        int queued = 0;
        int duplicates = 0;

        for (int i = 0; i < chunks.size(); i++) {
            String id = UUID.randomUUID().toString();
            OutboundMessage row = OutboundMessage.queuedText(
                    id,
                    MessageSplitter.chunkDedupeKey(request.dedupeKey(), i + 1, chunks.size()),
                    request.chatId(),
                    chunks.get(i),
                    request.priority(),
                    now
            );

            EnqueueOutcome outcome = store.enqueueOrIgnoreDedupe(row);
            if (outcome.duplicate()) {
                duplicates++;
            } else {
                queued++;
                messageIds.add(id);
            }
        }

        log.debug("outbound text enqueued chatId={} queued={} duplicates={} dedupeKey={}",
                request.chatId(), queued, duplicates, request.dedupeKey());
        return new EnqueueResult(
                queued > 0 ? EnqueueResult.Status.ENQUEUED : EnqueueResult.Status.DUPLICATE,
                queued,
                duplicates,
                messageIds,
                request.dedupeKey()
        );
    }

    public EnqueueResult enqueueFile(FileMessageRequest request, Instant now) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(now, "now must not be null");

        String id = UUID.randomUUID().toString();
        OutboundMessage row = OutboundMessage.queued(
                id,
                request.dedupeKey(),
                request.chatId(),
                request.kind(),
                request.caption() == null ? "" : request.caption(),
                request.filePath(),
                request.mimeType(),
                request.fileName(),
                request.priority(),
                now
        );

        EnqueueOutcome outcome = store.enqueueOrIgnoreDedupe(row);
        if (outcome.duplicate()) {
            log.debug("outbound file duplicate chatId={} dedupeKey={}", request.chatId(), request.dedupeKey());
            return new EnqueueResult(EnqueueResult.Status.DUPLICATE, 0, 1, List.of(), request.dedupeKey());
        }
        log.debug("outbound file enqueued chatId={} kind={} id={}", request.chatId(), request.kind(), id);
        return new EnqueueResult(EnqueueResult.Status.ENQUEUED, 1, 0, List.of(id), request.dedupeKey());
    }
}
