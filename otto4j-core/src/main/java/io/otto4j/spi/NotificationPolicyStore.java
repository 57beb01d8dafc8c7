package io.otto4j.spi;

import io.otto4j.core.outbound.NotificationPolicy;

import java.time.Instant;
import java.util.Optional;

/**
 * Access to the single notification policy. An empty result means nothing is ever suppressed.
 */
public interface NotificationPolicyStore {

    Optional<NotificationPolicy> get();

    /**
     * Records when the last digest was sent, creating the policy if none is stored yet.
     */
    void setLastDigestAt(Instant lastDigestAt, Instant updatedAt);

    /**
     * A store with no policy that ignores writes.
     */
    static NotificationPolicyStore none() {
        return new NotificationPolicyStore() {
            @Override
            public Optional<NotificationPolicy> get() {
                return Optional.empty();
            }

            @Override
            public void setLastDigestAt(Instant lastDigestAt, Instant updatedAt) {
            }
        };
    }
}
