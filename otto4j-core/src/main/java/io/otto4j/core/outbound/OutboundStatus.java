package io.otto4j.core.outbound;

public enum OutboundStatus {
    QUEUED,
    SENT,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != QUEUED;
    }
}
