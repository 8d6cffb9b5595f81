package com.questrail.chatwire.observability;

import java.time.Instant;

/**
 * Record representing one retransmission of a reliable datagram send.
 *
 * @param retryCount retry count after this retransmission (1 for the first resend)
 */
public record RetransmissionEvent(
    Instant timestamp,
    String peerIdentifier,
    long sequence,
    int retryCount
) {
}
