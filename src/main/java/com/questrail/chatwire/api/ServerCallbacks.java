package com.questrail.chatwire.api;

import java.util.Objects;

/**
 * The three collaborator callbacks a server is constructed with.
 *
 * <p>Callbacks are passed explicitly into each server and from there into each
 * session; nothing is wired through shared mutable state.</p>
 */
public record ServerCallbacks(
        MessageDeliveryListener messages,
        StatusListener status,
        PeerLifecycleListener lifecycle
) {
    private static final PeerLifecycleListener NO_LIFECYCLE = new PeerLifecycleListener() {
        @Override
        public void onPeerConnected(PeerInfo peer) {}

        @Override
        public void onPeerDisconnected(PeerInfo peer, CloseReason reason) {}
    };

    public ServerCallbacks {
        Objects.requireNonNull(messages, "messages");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(lifecycle, "lifecycle");
    }

    /**
     * Callbacks that ignore everything.
     */
    public static ServerCallbacks none() {
        return new ServerCallbacks((peer, text) -> {}, (text, error) -> {}, NO_LIFECYCLE);
    }

    public ServerCallbacks withMessages(MessageDeliveryListener listener) {
        return new ServerCallbacks(listener, status, lifecycle);
    }

    public ServerCallbacks withStatus(StatusListener listener) {
        return new ServerCallbacks(messages, listener, lifecycle);
    }

    public ServerCallbacks withLifecycle(PeerLifecycleListener listener) {
        return new ServerCallbacks(messages, status, listener);
    }
}
