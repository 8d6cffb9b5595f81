package com.questrail.chatwire.protocol.reliable;

import java.util.Objects;

/**
 * Sequence envelope nested inside the {@code content} of a reliable datagram
 * {@code message}.
 *
 * <pre>
 * { "sequence": &lt;int&gt;, "data": "&lt;string&gt;", "test_id": "&lt;string|null&gt;" }
 * </pre>
 *
 * @param sequence per-sender sequence number, from 0
 * @param data     the user's text
 * @param testId   optional correlation tag echoed back in the acknowledgement
 */
public record ReliableEnvelope(long sequence, String data, String testId) {
    public ReliableEnvelope {
        Objects.requireNonNull(data, "data");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }
}
