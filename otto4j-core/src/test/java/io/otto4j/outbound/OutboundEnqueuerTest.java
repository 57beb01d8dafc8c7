package io.otto4j.outbound;

import io.otto4j.core.outbound.MessageKind;
import io.otto4j.core.outbound.MessagePriority;
import io.otto4j.core.outbound.OutboundMessage;
import io.otto4j.core.outbound.OutboundStatus;
import io.otto4j.support.InMemoryOutboundMessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutboundEnqueuerTest {

    private static final Instant NOW = Instant.parse("2026-01-10T09:00:00Z");

    private InMemoryOutboundMessageStore store;
    private OutboundEnqueuer enqueuer;

    @BeforeEach
    void setUp() {
        store = new InMemoryOutboundMessageStore();
        enqueuer = new OutboundEnqueuer(store);
    }

    @Test
    void queuesTextAsDueImmediately() {
        EnqueueResult result = enqueuer.enqueueText(new TextMessageRequest(42L, "  hello  ", "greeting", null), NOW);

        assertThat(result.status()).isEqualTo(EnqueueResult.Status.ENQUEUED);
        assertThat(result.queuedCount()).isEqualTo(1);
        assertThat(result.messageIds()).hasSize(1);

        OutboundMessage row = store.all().get(0);
        assertThat(row.content()).isEqualTo("hello");
        assertThat(row.dedupeKey()).isEqualTo("greeting:1/1");
        assertThat(row.status()).isEqualTo(OutboundStatus.QUEUED);
        assertThat(row.priority()).isEqualTo(MessagePriority.NORMAL);
        assertThat(row.attemptCount()).isZero();
        assertThat(row.nextAttemptAt()).isEqualTo(NOW);
    }

    @Test
    void secondEnqueueWithSameDedupeKeyIsDuplicate() {
        TextMessageRequest request = new TextMessageRequest(42L, "daily digest", "digest:2026-01-10", MessagePriority.LOW);

        enqueuer.enqueueText(request, NOW);
        EnqueueResult second = enqueuer.enqueueText(request, NOW.plusSeconds(30));

        assertThat(second.isDuplicate()).isTrue();
        assertThat(second.queuedCount()).isZero();
        assertThat(second.duplicateCount()).isEqualTo(1);
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void messagesWithoutDedupeKeyAreNeverDeduplicated() {
        enqueuer.enqueueText(TextMessageRequest.of(42L, "ping"), NOW);
        enqueuer.enqueueText(TextMessageRequest.of(42L, "ping"), NOW);

        assertThat(store.all()).hasSize(2).allSatisfy(row -> assertThat(row.dedupeKey()).isNull());
    }

    @Test
    void longTextIsQueuedAsOrderedChunks() {
        String content = "x".repeat(MessageSplitter.MESSAGE_LIMIT) + "tail";

        EnqueueResult result = enqueuer.enqueueText(new TextMessageRequest(42L, content, "report", null), NOW);

        assertThat(result.queuedCount()).isEqualTo(2);
        List<OutboundMessage> rows = store.all();
        assertThat(rows).extracting(OutboundMessage::dedupeKey).containsExactly("report:1/2", "report:2/2");
        assertThat(rows.get(1).content()).isEqualTo("tail");
    }

    @Test
    void queuesDocumentWithCaption() {
        FileMessageRequest request = new FileMessageRequest(42L, MessageKind.DOCUMENT, "/tmp/report.pdf",
                "application/pdf", "report.pdf", "weekly report", "report:file", null);

        EnqueueResult first = enqueuer.enqueueFile(request, NOW);
        EnqueueResult second = enqueuer.enqueueFile(request, NOW);

        assertThat(first.status()).isEqualTo(EnqueueResult.Status.ENQUEUED);
        assertThat(second.isDuplicate()).isTrue();
        OutboundMessage row = store.all().get(0);
        assertThat(row.kind()).isEqualTo(MessageKind.DOCUMENT);
        assertThat(row.mediaPath()).isEqualTo("/tmp/report.pdf");
        assertThat(row.content()).isEqualTo("weekly report");
    }

    @Test
    void rejectsInvalidRequests() {
        assertThatThrownBy(() -> new TextMessageRequest(0L, "hi", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextMessageRequest(42L, "   ", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextMessageRequest(42L, "hi", "k".repeat(513), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FileMessageRequest(42L, MessageKind.TEXT, "/tmp/a", "text/plain", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
