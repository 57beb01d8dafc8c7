package io.otto4j.support;

import io.otto4j.core.outbound.NotificationPolicy;
import io.otto4j.core.outbound.QuietMode;
import io.otto4j.spi.NotificationPolicyStore;

import java.time.Instant;
import java.util.Optional;

public class InMemoryNotificationPolicyStore implements NotificationPolicyStore {

    private volatile NotificationPolicy policy;

    public InMemoryNotificationPolicyStore() {
    }

    public InMemoryNotificationPolicyStore(NotificationPolicy policy) {
        this.policy = policy;
    }

    @Override
    public Optional<NotificationPolicy> get() {
        return Optional.ofNullable(policy);
    }

    @Override
    public synchronized void setLastDigestAt(Instant lastDigestAt, Instant updatedAt) {
        NotificationPolicy current = policy != null ? policy
                : new NotificationPolicy(null, null, null, QuietMode.CRITICAL_ONLY, null,
                null, null, null, null, null, null, null, null);
        policy = current.withLastDigestAt(lastDigestAt);
    }

    public void set(NotificationPolicy policy) {
        this.policy = policy;
    }
}
