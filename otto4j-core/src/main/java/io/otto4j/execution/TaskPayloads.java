package io.otto4j.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.otto4j.core.Job;
import io.otto4j.heartbeat.HeartbeatTasks;
import io.otto4j.watchdog.WatchdogOptions;
import io.otto4j.watchdog.WatchdogTasks;

import java.util.Set;

/**
 * Interprets the opaque payload of a claimed job. The store never looks inside payloads.
 */
public final class TaskPayloads {

    public static final String INVALID_TASK_PAYLOAD = "invalid_task_payload";
    public static final String INVALID_WATCHDOG_PAYLOAD = "invalid_watchdog_payload";
    public static final String INVALID_HEARTBEAT_PAYLOAD = "invalid_heartbeat_payload";

    private TaskPayloads() {
    }

    /**
     * @throws InvalidTaskPayloadException when the payload is not valid JSON or does not fit the job type
     */
    public static TaskPayload interpret(Job job, ObjectMapper objectMapper) {
        if (WatchdogTasks.WATCHDOG_TASK_TYPE.equals(job.type())) {
            return new TaskPayload.Watchdog(watchdogOptions(readPayload(job.payload(), objectMapper, INVALID_WATCHDOG_PAYLOAD)));
        }
        if (HeartbeatTasks.HEARTBEAT_TASK_TYPE.equals(job.type())) {
            return new TaskPayload.Heartbeat(heartbeatChatId(readPayload(job.payload(), objectMapper, INVALID_HEARTBEAT_PAYLOAD)));
        }
        return new TaskPayload.Assistant(readPayload(job.payload(), objectMapper, INVALID_TASK_PAYLOAD));
    }

    private static JsonNode readPayload(String payload, ObjectMapper objectMapper, String code) {
        if (payload == null || payload.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidTaskPayloadException(code, "Task payload is not valid JSON");
        }
    }

    private static WatchdogOptions watchdogOptions(JsonNode node) {
        if (!node.isNull() && !node.isObject()) {
            throw new InvalidTaskPayloadException(INVALID_WATCHDOG_PAYLOAD, "Watchdog payload must be an object");
        }
        try {
            return new WatchdogOptions(
                    intField(node, "lookbackMinutes", WatchdogOptions.DEFAULT_LOOKBACK_MINUTES),
                    intField(node, "maxFailures", WatchdogOptions.DEFAULT_MAX_FAILURES),
                    intField(node, "threshold", WatchdogOptions.DEFAULT_THRESHOLD),
                    booleanField(node, "notify", true),
                    chatIdField(node),
                    Set.of(WatchdogTasks.WATCHDOG_TASK_TYPE)
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskPayloadException(INVALID_WATCHDOG_PAYLOAD, e.getMessage());
        }
    }

    /**
     * A heartbeat payload that does not carry a usable positive chat id falls back to the default recipient.
     */
    private static Long heartbeatChatId(JsonNode node) {
        JsonNode value = node.path("chatId");
        if (!value.isIntegralNumber() || !value.canConvertToLong() || value.longValue() < 1) {
            return null;
        }
        return value.longValue();
    }

    private static int intField(JsonNode node, String field, int defaultValue) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return defaultValue;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return value.intValue();
    }

    private static boolean booleanField(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(field + " must be a boolean");
        }
        return value.booleanValue();
    }

    private static Long chatIdField(JsonNode node) {
        JsonNode value = node.path("chatId");
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new IllegalArgumentException("chatId must be an integer");
        }
        return value.longValue();
    }
}
