package com.questrail.chatwire.api;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a connected peer, handed to collaborator callbacks.
 *
 * @param identifier  address-derived identifier, {@code "ip:port"}
 * @param displayName current display name of the peer
 * @param protocol    transport the peer is connected over
 * @param address     remote socket address
 * @param connectedAt wall-clock time the session was created (observational)
 */
public record PeerInfo(
        String identifier,
        String displayName,
        TransportProtocol protocol,
        SocketAddress address,
        Instant connectedAt
) {
    public PeerInfo {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(connectedAt, "connectedAt");
    }
}
