package com.questrail.chatwire.api;

/**
 * Receives peer connect and disconnect notifications.
 *
 * <p>{@link #onPeerConnected(PeerInfo)} fires when a session completes its
 * handshake. {@link #onPeerDisconnected(PeerInfo, CloseReason)} fires exactly
 * once per connected session, after the session has been deregistered and its
 * socket released.</p>
 */
public interface PeerLifecycleListener
{
    void onPeerConnected(PeerInfo peer);

    void onPeerDisconnected(PeerInfo peer, CloseReason reason);
}
