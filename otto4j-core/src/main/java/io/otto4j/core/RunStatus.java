package io.otto4j.core;

import java.util.Locale;

/**
 * Outcome of a single job execution. The lowercase {@link #value()} is what task results carry.
 */
public enum RunStatus {
    SUCCESS("success"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @return the matching status, or null when {@code raw} is not one of success/failed/skipped
     */
    public static RunStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RunStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
