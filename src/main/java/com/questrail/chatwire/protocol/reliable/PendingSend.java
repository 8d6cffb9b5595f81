package com.questrail.chatwire.protocol.reliable;

import java.util.Objects;

/**
 * Bookkeeping for one outstanding reliable send.
 *
 * <p>Mutable. Instances are only touched while the owning
 * {@link ReliableDatagramSender} holds its lock.</p>
 */
public final class PendingSend
{
    private final long sequence;
    private final byte[] payload;
    private long sendTimeNanos;
    private int retryCount;

    PendingSend(long sequence, byte[] payload, long sendTimeNanos)
    {
        this.sequence = sequence;
        this.payload = Objects.requireNonNull(payload, "payload");
        this.sendTimeNanos = sendTimeNanos;
    }

    public long sequence() {
        return sequence;
    }

    /**
     * The exact encoded datagram; every retransmission resends these bytes.
     */
    byte[] payload() {
        return payload;
    }

    public long sendTimeNanos() {
        return sendTimeNanos;
    }

    public int retryCount() {
        return retryCount;
    }

    boolean isOlderThan(long timeoutNanos, long nowNanos) {
        return nowNanos - sendTimeNanos >= timeoutNanos;
    }

    void recordRetransmission(long nowNanos) {
        retryCount++;
        sendTimeNanos = nowNanos;
    }

    @Override
    public String toString() {
        return "PendingSend[sequence=" + sequence + ", retryCount=" + retryCount + "]";
    }
}
