package com.questrail.chatwire.session;

import com.questrail.chatwire.api.PeerInfo;
import com.questrail.chatwire.api.TransportProtocol;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Server-side bookkeeping for one connected peer.
 *
 * <p>Identity fields are fixed at creation. The display name and the
 * last-activity tick are updated by the session's receive thread and read by
 * any thread (reaper, status callbacks).</p>
 */
public final class PeerRecord
{
    private final String identifier;
    private final SocketAddress address;
    private final TransportProtocol protocol;
    private final Instant connectedAt;

    private volatile String displayName;
    private volatile long lastActivityNanos;

    public PeerRecord(SocketAddress address, TransportProtocol protocol, Instant connectedAt, long nowNanos)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
        this.identifier = identifierOf(address);
        this.displayName = defaultDisplayName(address);
        this.lastActivityNanos = nowNanos;
    }

    /**
     * {@code "ip:port"} for an IP socket address, {@code toString()} otherwise.
     */
    public static String identifierOf(SocketAddress address)
    {
        if (address instanceof InetSocketAddress inet) {
            String host = inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
            return host + ":" + inet.getPort();
        }
        return address.toString();
    }

    /**
     * Name a peer carries until its Connect names it: {@code User_<n>}, n derived
     * from the address.
     */
    public static String defaultDisplayName(SocketAddress address)
    {
        return "User_" + Math.floorMod(address.hashCode(), 10000);
    }

    public String identifier() {
        return identifier;
    }

    public SocketAddress address() {
        return address;
    }

    public TransportProtocol protocol() {
        return protocol;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public String displayName() {
        return displayName;
    }

    void rename(String newName) {
        this.displayName = Objects.requireNonNull(newName, "newName");
    }

    public long lastActivityNanos() {
        return lastActivityNanos;
    }

    void touch(long nowNanos) {
        this.lastActivityNanos = nowNanos;
    }

    public PeerInfo toPeerInfo() {
        return new PeerInfo(identifier, displayName, protocol, address, connectedAt);
    }
}
