package com.questrail.chatwire.client;

import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.transport.PeerUnreachableException;

/**
 * ChatClient
 * =============================================================================
 * Client side of one chat connection.
 *
 * <p>{@link #connect(String)} is synchronous and fails fast when the server
 * cannot be reached. After {@link #disconnect()} (or a lost connection) the
 * client may connect again.</p>
 */
public interface ChatClient extends AutoCloseable
{
    /**
     * Connects and announces {@code displayName} to the server.
     *
     * @throws PeerUnreachableException if the server did not answer in time
     * @throws IllegalStateException    if already connected
     */
    void connect(String displayName) throws PeerUnreachableException;

    /**
     * Sends chat text. Over datagrams the text is delivered reliably.
     *
     * @return {@code false} if not connected, the send failed or the text is
     *         too large for one stream frame (the connection stays up)
     */
    boolean send(String text);

    /**
     * Sends a status notice.
     */
    boolean sendStatus(String text);

    /**
     * Sends a test message; the server's echo is reported to
     * {@link ChatClientListener#onLatency(java.time.Duration)}.
     */
    boolean sendTest();

    /**
     * Sends a best-effort Disconnect, then releases every local resource even
     * if that send fails. Idempotent.
     */
    void disconnect();

    boolean isConnected();

    /**
     * Name given to the last {@link #connect(String)}, or {@code null}.
     */
    String displayName();

    TransportProtocol protocol();

    @Override
    default void close()
    {
        disconnect();
    }
}
