package com.questrail.chatwire.api;

/**
 * Why a session (server side) or a connection (client side) was torn down.
 *
 * <p>Collaborators use this to tell a peer that left on purpose apart from a
 * connection that was lost, and both apart from a local stop.</p>
 */
public enum CloseReason {
    /** The peer sent an explicit Disconnect. */
    PEER_DISCONNECTED(false),
    /** The stream reached end-of-stream without a Disconnect. */
    PEER_CLOSED(false),
    /** Reset, broken pipe or any other transport-level read failure. */
    TRANSPORT_RESET(true),
    /** A single send failed; the socket is presumed broken. */
    SEND_FAILURE(true),
    /** A frame header claimed a body larger than the frame limit. */
    FRAME_TOO_LARGE(true),
    /** Too many consecutive frames failed to decode. */
    DECODE_FAILURES(true),
    /** A datagram peer stayed silent past the inactivity timeout. */
    INACTIVITY_TIMEOUT(true),
    /** A reliable send exhausted its retry ceiling without an acknowledgement. */
    RETRIES_EXHAUSTED(true),
    /** The local server is shutting down. */
    SERVER_STOPPED(false),
    /** The local client disconnected. */
    CLIENT_DISCONNECTED(false);

    private final boolean connectionLost;

    CloseReason(boolean connectionLost) {
        this.connectionLost = connectionLost;
    }

    /**
     * {@code true} when the connection was lost rather than closed on purpose
     * by either side.
     */
    public boolean isConnectionLost() {
        return connectionLost;
    }
}
