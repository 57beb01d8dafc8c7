package io.otto4j.outbound;

import io.otto4j.core.RunStatus;
import io.otto4j.core.RunSummary;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Text sent in place of messages that were held by quiet hours or a mute once delivery resumes.
 */
public final class QuietPeriodDigest {

    static final int MAX_ISSUES = 3;

    private QuietPeriodDigest() {
    }

    public static String summarize(List<RunSummary> runs) {
        if (runs.isEmpty()) {
            return "No task activity happened while notifications were paused.";
        }

        List<RunSummary> failures = runs.stream()
                .filter(run -> run.status() == RunStatus.FAILED)
                .collect(Collectors.toList());
        long succeeded = runs.stream().filter(run -> run.status() == RunStatus.SUCCESS).count();
        long skipped = runs.stream().filter(run -> run.status() == RunStatus.SKIPPED).count();
        String issues = failures.stream()
                .limit(MAX_ISSUES)
                .map(run -> run.errorMessage() != null ? run.errorMessage()
                        : run.errorCode() != null ? run.errorCode() : "unknown error")
                .collect(Collectors.joining(" | "));

        return "Summary from your muted/quiet period:\n"
                + runs.size() + " scheduled runs completed (" + succeeded + " success, "
                + failures.size() + " failed, " + skipped + " skipped).\n"
                + (issues.isEmpty() ? "No major failures detected." : "Main issues: " + issues + ".");
    }
}
