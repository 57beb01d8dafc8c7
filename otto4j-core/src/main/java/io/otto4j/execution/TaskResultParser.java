package io.otto4j.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.otto4j.core.RunStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant parser for gateway output that is supposed to be a {@code {status, summary, errors}} object.
 *
 * <p>The whole trimmed output is tried first, then the first fenced {@code json} block. String entries in
 * {@code errors} are accepted and normalized to code {@value #TASK_ERROR_CODE}; an {@code errors} value that is
 * not an array is ignored.
 */
public class TaskResultParser {

    public static final String INVALID_RESULT_JSON = "invalid_result_json";
    public static final String INVALID_RESULT_SCHEMA = "invalid_result_schema";
    static final String TASK_ERROR_CODE = "task_error";

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```", Pattern.CASE_INSENSITIVE);

    private final ObjectReader reader;

    public TaskResultParser(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ResultParseOutcome parse(String output) {
        String trimmed = output == null ? "" : output.trim();
        if (trimmed.isEmpty()) {
            return new ResultParseOutcome.ParseFailed(INVALID_RESULT_JSON, "Task execution returned empty output", null);
        }

        JsonNode direct = readJson(trimmed);
        if (direct != null) {
            return validate(direct, trimmed, false);
        }

        Matcher fenced = FENCED_JSON.matcher(trimmed);
        if (fenced.find() && !fenced.group(1).isEmpty()) {
            JsonNode inner = readJson(fenced.group(1));
            if (inner != null) {
                return validate(inner, trimmed, true);
            }
        }

        return new ResultParseOutcome.ParseFailed(INVALID_RESULT_JSON, "Task execution output must be valid JSON", trimmed);
    }

    private JsonNode readJson(String text) {
        try {
            JsonNode node = reader.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private ResultParseOutcome validate(JsonNode node, String rawOutput, boolean fenced) {
        List<String> problems = new ArrayList<>();
        if (!node.isObject()) {
            return schemaFailure(List.of("root: expected object"), rawOutput);
        }

        JsonNode statusNode = node.path("status");
        RunStatus status = statusNode.isTextual() ? RunStatus.fromValue(statusNode.asText()) : null;
        if (status == null || !statusNode.asText().equals(status.value())) {
            problems.add("status: must be one of success, failed, skipped");
        }

        JsonNode summaryNode = node.path("summary");
        String summary = summaryNode.isTextual() ? summaryNode.asText().trim() : null;
        if (summary == null || summary.isEmpty()) {
            problems.add("summary: must be a non-empty string");
        }

        List<TaskError> errors = normalizeErrors(node.path("errors"), problems);
        if (!problems.isEmpty()) {
            return schemaFailure(problems, rawOutput);
        }

        TaskResult result = new TaskResult(status, summary, errors);
        return fenced ? new ResultParseOutcome.FencedParsed(result) : new ResultParseOutcome.Parsed(result);
    }

    private static List<TaskError> normalizeErrors(JsonNode errorsNode, List<String> problems) {
        List<TaskError> errors = new ArrayList<>();
        // anything other than an array is dropped
        if (!errorsNode.isArray()) {
            return errors;
        }

        int index = 0;
        for (JsonNode entry : errorsNode) {
            if (entry.isTextual()) {
                String message = entry.asText().trim();
                if (message.isEmpty()) {
                    problems.add("errors." + index + ": must not be blank");
                } else {
                    errors.add(new TaskError(TASK_ERROR_CODE, message));
                }
            } else if (entry.isObject()) {
                String code = entry.path("code").isTextual() ? entry.path("code").asText().trim() : "";
                String message = entry.path("message").isTextual() ? entry.path("message").asText().trim() : "";
                if (!code.isEmpty() && !message.isEmpty()) {
                    errors.add(new TaskError(code, message));
                } else {
                    errors.add(new TaskError(TASK_ERROR_CODE, entry.toString()));
                }
            } else if (!entry.isNull()) {
                errors.add(new TaskError(TASK_ERROR_CODE, entry.asText()));
            }
            index++;
        }
        return errors;
    }

    private static ResultParseOutcome schemaFailure(List<String> problems, String rawOutput) {
        return new ResultParseOutcome.ParseFailed(INVALID_RESULT_SCHEMA, String.join("; ", problems), rawOutput);
    }
}
