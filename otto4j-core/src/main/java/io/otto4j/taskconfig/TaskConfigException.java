package io.otto4j.taskconfig;

public class TaskConfigException extends RuntimeException {

    public TaskConfigException(String message) {
        super(message);
    }

    public TaskConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
