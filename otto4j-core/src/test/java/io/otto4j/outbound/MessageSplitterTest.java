package io.otto4j.outbound;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageSplitterTest {

    @Test
    void shortContentIsASingleChunk() {
        assertThat(MessageSplitter.split("hello")).containsExactly("hello");
    }

    @Test
    void longContentIsSplitAtTheLimitInOrder() {
        String content = "a".repeat(4096) + "b".repeat(4096) + "c";

        List<String> chunks = MessageSplitter.split(content);

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(0)).isEqualTo("a".repeat(4096));
        assertThat(chunks.get(1)).isEqualTo("b".repeat(4096));
        assertThat(chunks.get(2)).isEqualTo("c");
        assertThat(String.join("", chunks)).isEqualTo(content);
    }

    @Test
    void chunkDedupeKeyCarriesIndexAndTotal() {
        assertThat(MessageSplitter.chunkDedupeKey("digest:2026-01-10", 1, 1)).isEqualTo("digest:2026-01-10:1/1");
        assertThat(MessageSplitter.chunkDedupeKey("digest:2026-01-10", 2, 3)).isEqualTo("digest:2026-01-10:2/3");
        assertThat(MessageSplitter.chunkDedupeKey(null, 1, 1)).isNull();
    }
}
