package io.otto4j.schedule;

/**
 * A job's schedule fields violate an invariant. This is a configuration error, not a runtime condition.
 */
public class InvalidScheduleException extends IllegalStateException {

    public InvalidScheduleException(String message) {
        super(message);
    }
}
