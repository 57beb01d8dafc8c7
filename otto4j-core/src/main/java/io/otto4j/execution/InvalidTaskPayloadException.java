package io.otto4j.execution;

/**
 * A job payload could not be interpreted for its type. Carries the run error code to record.
 */
public class InvalidTaskPayloadException extends RuntimeException {

    private final String code;

    public InvalidTaskPayloadException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
