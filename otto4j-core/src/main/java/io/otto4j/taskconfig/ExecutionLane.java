package io.otto4j.taskconfig;

/**
 * Execution context used to pick configuration overlays.
 */
public enum ExecutionLane {
    INTERACTIVE("interactive"),
    SCHEDULED("scheduled");

    private final String key;

    ExecutionLane(String key) {
        this.key = key;
    }

    /**
     * Name of the lane inside task config files.
     */
    public String key() {
        return key;
    }
}
