package io.otto4j.outbound;

/**
 * Counts of what one drain cycle did. {@code skipped} is true when another drain was already running.
 */
public record DrainSummary(
        int sent,
        int retried,
        int failed,
        int suppressed,
        boolean skipped
) {
    public static DrainSummary skippedDrain() {
        return new DrainSummary(0, 0, 0, 0, true);
    }

    public int processed() {
        return sent + retried + failed + suppressed;
    }
}
