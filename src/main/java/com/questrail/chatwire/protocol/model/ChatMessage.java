package com.questrail.chatwire.protocol.model;

import java.time.Instant;
import java.util.Objects;

/**
 * ChatMessage
 * =============================================================================
 * The unit of communication between peers.
 *
 * <p>Every wire-encoded message carries at least {@code kind}, {@code content}
 * and {@code timestamp}; a decoded message is never partially populated.</p>
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code kind}: closed {@link MessageKind}</li>
 *   <li>{@code content}: arbitrary text; for reliable datagram chat this is the
 *       nested sequence envelope, not the user's text</li>
 *   <li>{@code sender}: display name of the originating peer, or {@code null}</li>
 *   <li>{@code timestamp}: producer-assigned seconds since the epoch. A
 *       {@link MessageKind#TEST} echo carries the original value unchanged so the
 *       originator can measure latency.</li>
 *   <li>{@code version}: protocol version tag, carried and echoed, never branched on</li>
 * </ul>
 */
public record ChatMessage(
        MessageKind kind,
        String content,
        String sender,
        double timestamp,
        String version
) {
    /** Version tag stamped on every message this library produces. */
    public static final String PROTOCOL_VERSION = "1.0";

    public ChatMessage {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(version, "version");
    }

    /**
     * Creates a message stamped with the given wall-clock time and the current
     * protocol version.
     */
    public static ChatMessage of(MessageKind kind, String content, String sender, Instant now) {
        return new ChatMessage(kind, content, sender, epochSeconds(now), PROTOCOL_VERSION);
    }

    /**
     * Same message with a different sender. Timestamp, version and content are
     * preserved, which is exactly what a {@code TEST} echo requires.
     */
    public ChatMessage withSender(String newSender) {
        return new ChatMessage(kind, content, newSender, timestamp, version);
    }

    /**
     * Same message with different content.
     */
    public ChatMessage withContent(String newContent) {
        return new ChatMessage(kind, newContent, sender, timestamp, version);
    }

    /**
     * Fractional seconds since the epoch for the given instant.
     */
    public static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
