package com.questrail.chatwire.transport;

import java.io.IOException;
import java.net.SocketAddress;

/**
 * A client could not reach its server: the stream connect failed or timed out,
 * or the datagram reachability probe got no reply in time.
 *
 * <p>Surfaced to the caller of {@code connect()}; never retried internally.</p>
 */
public final class PeerUnreachableException extends IOException
{
    private final SocketAddress address;

    public PeerUnreachableException(SocketAddress address, String message) {
        super(message + ": " + address);
        this.address = address;
    }

    public PeerUnreachableException(SocketAddress address, String message, Throwable cause) {
        super(message + ": " + address, cause);
        this.address = address;
    }

    public SocketAddress address() {
        return address;
    }
}
