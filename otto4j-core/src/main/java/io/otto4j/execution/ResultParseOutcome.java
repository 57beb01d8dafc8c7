package io.otto4j.execution;

/**
 * Outcome of interpreting gateway output as a {@link TaskResult}.
 *
 * <ul>
 *   <li>{@link Parsed}: the whole output was a valid result object</li>
 *   <li>{@link FencedParsed}: a valid result object was found inside a fenced json block</li>
 *   <li>{@link ParseFailed}: no usable result; a failed result is synthesized</li>
 * </ul>
 */
public interface ResultParseOutcome {

    TaskResult result();

    /**
     * Trimmed gateway output to keep alongside the result; null when parsing succeeded.
     */
    String rawOutput();

    record Parsed(TaskResult result) implements ResultParseOutcome {
        @Override
        public String rawOutput() {
            return null;
        }
    }

    record FencedParsed(TaskResult result) implements ResultParseOutcome {
        @Override
        public String rawOutput() {
            return null;
        }
    }

    record ParseFailed(String code, String reason, String rawOutput) implements ResultParseOutcome {
        @Override
        public TaskResult result() {
            return TaskResult.failure(code, reason);
        }
    }
}
