package io.otto4j.spi;

import java.time.Instant;
import java.util.Optional;

/**
 * Maps a stable binding key to the gateway session that serves it.
 */
public interface SessionBindingStore {

    Optional<String> findSessionId(String bindingKey);

    void upsert(String bindingKey, String sessionId, Instant updatedAt);
}
