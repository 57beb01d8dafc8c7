package io.otto4j.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.otto4j.core.Job;

import java.time.Instant;
import java.util.Locale;

/**
 * Builds the prompt that asks the gateway to run a scheduled task and answer with a result object.
 */
final class ExecutionPrompt {

    private ExecutionPrompt() {
    }

    static String build(Job job, JsonNode payload, Instant executedAt, ObjectMapper objectMapper) {
        ObjectNode task = objectMapper.createObjectNode();
        task.put("id", job.id());
        task.put("type", job.type());
        task.put("scheduleType", job.scheduleType() == null ? null : job.scheduleType().name().toLowerCase(Locale.ROOT));
        task.put("profileId", job.profileId());
        task.set("payload", payload);
        task.put("executedAt", executedAt.toString());

        String taskJson;
        try {
            taskJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize task for prompt", e);
        }

        return String.join("\n",
                "Execute this scheduled task now.",
                "Return only a JSON object with keys: status, summary, errors.",
                "status must be one of: success, failed, skipped.",
                "Do not ask clarifying questions and do not include markdown.",
                "",
                "Task:",
                taskJson);
    }
}
