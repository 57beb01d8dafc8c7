package io.otto4j.core.outbound;

/**
 * Delivery priority of an outbound message.
 *
 * <p>Priority never reorders the drain; it only decides whether a message may bypass quiet hours
 * and mute windows.
 */
public enum MessagePriority {

    LOW,
    NORMAL,
    HIGH;

    /**
     * Override tier: delivered even while the recipient is muted or in quiet hours.
     */
    public boolean bypassesPolicy() {
        return this == HIGH;
    }
}
