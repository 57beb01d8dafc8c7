package io.otto4j.core.outbound;

public enum MessageKind {
    TEXT,
    DOCUMENT,
    PHOTO;

    public boolean hasMedia() {
        return this != TEXT;
    }
}
