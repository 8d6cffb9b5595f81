package com.questrail.chatwire.session;

/**
 * Lifecycle of one peer session.
 *
 * <pre>
 * HANDSHAKING --Connect--> ACTIVE --Disconnect / fatal error / stop--> CLOSING --> CLOSED
 *      \________________________ fatal error / stop _______________________/
 * </pre>
 */
public enum SessionState {
    HANDSHAKING,
    ACTIVE,
    CLOSING,
    CLOSED
}
