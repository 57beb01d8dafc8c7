package io.otto4j.taskconfig;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Contents of {@code task-config/profiles/<id>.jsonc}.
 */
public record TaskProfile(
        String id,
        String description,
        Map<ExecutionLane, ObjectNode> laneOverrides
) {
    public TaskProfile {
        laneOverrides = laneOverrides == null ? Map.of() : Map.copyOf(laneOverrides);
    }
}
