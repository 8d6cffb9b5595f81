package com.questrail.chatwire.server;

import com.questrail.chatwire.api.PeerInfo;
import com.questrail.chatwire.api.TransportProtocol;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.List;

/**
 * ChatServer
 * =============================================================================
 * A chat server on one transport.
 *
 * <p>A server is started at most once. {@link #stop()} is idempotent and
 * returns after every thread the server started has exited or the configured
 * shutdown timeout has elapsed.</p>
 */
public interface ChatServer extends AutoCloseable
{
    /**
     * Binds and starts serving.
     *
     * @throws IOException if the bind address cannot be bound
     * @throws IllegalStateException if the server was already started
     */
    void start() throws IOException;

    void stop();

    /**
     * Sends chat text from the server identity to one peer.
     *
     * @return {@code false} if the peer is unknown, the send failed or the text
     *         is too large for one stream frame
     */
    boolean send(String peerIdentifier, String text);

    /**
     * Sends chat text from the server identity to every connected peer.
     *
     * @return number of peers the message was handed to
     */
    int broadcast(String text);

    List<PeerInfo> peers();

    int peerCount();

    boolean isRunning();

    /**
     * The bound local address, or {@code null} when not running.
     */
    SocketAddress localAddress();

    /**
     * One-line summary: {@code "Running on host:port - Clients: n"} or {@code "Stopped"}.
     */
    String statusLine();

    TransportProtocol protocol();

    @Override
    default void close()
    {
        stop();
    }
}
