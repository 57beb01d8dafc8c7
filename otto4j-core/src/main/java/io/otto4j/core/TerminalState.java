package io.otto4j.core;

public enum TerminalState {
    COMPLETED,
    EXPIRED,
    CANCELLED
}
