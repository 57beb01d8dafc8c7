package io.otto4j.core.outbound;

public enum QuietMode {
    /**
     * Only override-priority messages are delivered inside quiet hours.
     */
    CRITICAL_ONLY,
    /**
     * Quiet hours are ignored.
     */
    OFF
}
