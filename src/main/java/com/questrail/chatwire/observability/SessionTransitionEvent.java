package com.questrail.chatwire.observability;

import com.questrail.chatwire.session.SessionState;

import java.time.Instant;

/**
 * Record representing a session lifecycle transition.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    String peerIdentifier,
    SessionState oldState,
    SessionState newState,
    String cause
) {
    /**
     * Checks if this transition completed the handshake.
     */
    public boolean isActivation() {
        return oldState != SessionState.ACTIVE && newState == SessionState.ACTIVE;
    }
}
