package com.questrail.chatwire.observability;

import java.time.Instant;

/**
 * Record representing a change of a peer's advisory recovery mode.
 */
public record RecoveryModeEvent(
    Instant timestamp,
    String peerIdentifier,
    boolean active,
    int pendingSends
) {
}
