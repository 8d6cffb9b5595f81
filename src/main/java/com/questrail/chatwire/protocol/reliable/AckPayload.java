package com.questrail.chatwire.protocol.reliable;

/**
 * Content of an {@code ack} message.
 *
 * <pre>
 * { "sequence": &lt;int&gt;, "test_id": "&lt;string|null&gt;" }
 * </pre>
 */
public record AckPayload(long sequence, String testId) {
    public AckPayload {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }

    /**
     * Acknowledgement matching a received envelope.
     */
    public static AckPayload acknowledging(ReliableEnvelope envelope) {
        return new AckPayload(envelope.sequence(), envelope.testId());
    }
}
