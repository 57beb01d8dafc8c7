package io.otto4j.watchdog;

public enum NotificationStatus {
    NOT_REQUESTED("not_requested"),
    ENQUEUED("enqueued"),
    DUPLICATE("duplicate"),
    /**
     * An alert was due but no recipient chat id could be resolved. Nothing was queued.
     */
    NOTIFICATION_UNAVAILABLE("notification_unavailable");

    private final String value;

    NotificationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
