package com.questrail.chatwire.protocol.model;

import java.util.Optional;

/**
 * Closed set of message kinds carried in the {@code "type"} field.
 *
 * <p>The wire name of {@link #CHAT} is {@code "message"}; every other kind
 * uses its lower-case name. Any other wire value is a decode error.</p>
 */
public enum MessageKind {
    CONNECT("connect"),
    DISCONNECT("disconnect"),
    CHAT("message"),
    STATUS("status"),
    ERROR("error"),
    TEST("test"),
    ACK("ack");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a kind by its exact wire name.
     *
     * @return the kind, or empty for an unrecognized value
     */
    public static Optional<MessageKind> fromWireName(String wireName) {
        for (MessageKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
