package com.questrail.chatwire.protocol.reliable;

import com.questrail.chatwire.config.ReliabilityPolicy;
import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.WallClock;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.WireCodec;

import java.util.Objects;

/**
 * Collaborators shared by every reliable channel of one server or client.
 *
 * <p>Monotonic time drives retry decisions. Wall-clock time only stamps
 * acknowledgements and observability events.</p>
 */
public record ReliableTransportContext(
        WireCodec codec,
        EnvelopeCodec envelopes,
        ReliabilityPolicy policy,
        MonotonicClock clock,
        WallClock wallClock,
        ChatObservabilitySink observability
) {
    public ReliableTransportContext {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(envelopes, "envelopes");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(observability, "observability");
    }
}
