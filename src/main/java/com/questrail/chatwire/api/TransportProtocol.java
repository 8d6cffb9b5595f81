package com.questrail.chatwire.api;

/**
 * Transport a peer is connected over.
 */
public enum TransportProtocol {
    /** Connection-oriented, length-prefixed frames (TCP). */
    STREAM,
    /** Connectionless, one message per datagram, reliable sends for chat (UDP). */
    DATAGRAM
}
