package com.questrail.chatwire.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the chat transport stack.
 *
 * @param peerIdentifier affected peer, or {@code null} for transport-wide errors
 */
public record ChatErrorEvent(
    Instant timestamp,
    String peerIdentifier,
    String message,
    Throwable cause
) {
}
