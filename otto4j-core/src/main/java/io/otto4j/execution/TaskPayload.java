package io.otto4j.execution;

import com.fasterxml.jackson.databind.JsonNode;
import io.otto4j.watchdog.WatchdogOptions;

/**
 * A job payload interpreted according to the job's type.
 */
public interface TaskPayload {

    /**
     * Payload of the system failure watchdog.
     */
    record Watchdog(WatchdogOptions options) implements TaskPayload {
    }

    /**
     * Payload of the heartbeat task.
     *
     * @param chatId recipient; null falls back to the configured default
     */
    record Heartbeat(Long chatId) implements TaskPayload {
    }

    /**
     * Free-form payload handed to the assistant as part of the execution prompt.
     */
    record Assistant(JsonNode payload) implements TaskPayload {
    }
}
