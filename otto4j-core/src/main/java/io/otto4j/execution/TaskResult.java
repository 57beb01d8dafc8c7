package io.otto4j.execution;

import io.otto4j.core.RunStatus;

import java.util.List;
import java.util.Objects;

/**
 * Structured outcome of one task execution: {@code {status, summary, errors[]}}.
 */
public record TaskResult(
        RunStatus status,
        String summary,
        List<TaskError> errors
) {
    public TaskResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static TaskResult success(String summary) {
        return new TaskResult(RunStatus.SUCCESS, summary, List.of());
    }

    public static TaskResult failure(String code, String message) {
        return new TaskResult(RunStatus.FAILED, message, List.of(new TaskError(code, message)));
    }

    /**
     * Error code recorded on the run: the first reported error, or {@code task_failed}.
     * Null unless the result failed.
     */
    public String runErrorCode() {
        if (status != RunStatus.FAILED) {
            return null;
        }
        return errors.isEmpty() ? "task_failed" : errors.get(0).code();
    }

    /**
     * Error message recorded on the run: the first reported error, or the summary.
     * Null unless the result failed.
     */
    public String runErrorMessage() {
        if (status != RunStatus.FAILED) {
            return null;
        }
        return errors.isEmpty() ? summary : errors.get(0).message();
    }
}
