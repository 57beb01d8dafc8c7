package io.otto4j.taskconfig;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Contents of {@code task-config/base.jsonc}: global gateway config plus optional per-lane overlays.
 */
public record TaskRuntimeBaseConfig(
        ObjectNode base,
        Map<ExecutionLane, ObjectNode> lanes
) {
    public TaskRuntimeBaseConfig {
        lanes = lanes == null ? Map.of() : Map.copyOf(lanes);
    }
}
