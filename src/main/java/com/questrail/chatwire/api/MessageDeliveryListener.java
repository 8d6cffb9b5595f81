package com.questrail.chatwire.api;

/**
 * Receives chat text delivered by a session.
 *
 * <p>Invoked from whichever transport thread observed the message: a stream
 * session's handler thread or the datagram receive thread. Implementations
 * that cross into a single-threaded presentation layer must hand off
 * themselves.</p>
 */
@FunctionalInterface
public interface MessageDeliveryListener
{
    void onMessage(PeerInfo peer, String text);
}
