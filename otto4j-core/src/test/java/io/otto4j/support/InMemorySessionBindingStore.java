package io.otto4j.support;

import io.otto4j.spi.SessionBindingStore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionBindingStore implements SessionBindingStore {

    private final Map<String, String> bindings = new ConcurrentHashMap<>();

    @Override
    public Optional<String> findSessionId(String bindingKey) {
        return Optional.ofNullable(bindings.get(bindingKey));
    }

    @Override
    public void upsert(String bindingKey, String sessionId, Instant updatedAt) {
        bindings.put(bindingKey, sessionId);
    }
}
