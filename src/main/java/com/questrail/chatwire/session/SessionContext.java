package com.questrail.chatwire.session;

import com.questrail.chatwire.api.ServerCallbacks;
import com.questrail.chatwire.config.ServerConfig;
import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.WallClock;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.WireCodec;

import java.util.Objects;

/**
 * Everything a session borrows from its server.
 */
public record SessionContext(
        ServerConfig config,
        ServerCallbacks callbacks,
        WireCodec codec,
        MonotonicClock clock,
        WallClock wallClock,
        ChatObservabilitySink observability,
        PeerRegistry<?> registry,
        SessionOwner owner
) {
    public SessionContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(callbacks, "callbacks");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(observability, "observability");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(owner, "owner");
    }
}
