package com.questrail.chatwire.client;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.protocol.model.ChatMessage;

import java.time.Duration;

/**
 * Receives what a {@link ChatClient} hears from its server.
 *
 * <p>Invoked from the client's receive thread.</p>
 */
public interface ChatClientListener
{
    /**
     * A chat, status, error or connect message from the server. Acknowledgements
     * and test echoes never arrive here.
     */
    void onMessage(ChatMessage message);

    /**
     * One-way latency of a test message: local receive time minus the
     * timestamp the message was sent with.
     */
    default void onLatency(Duration latency) {
    }

    /**
     * The connection ended without a local {@link ChatClient#disconnect()}:
     * the server disconnected, closed the stream, or the transport failed.
     * Local resources are already released when this is called.
     */
    default void onDisconnected(CloseReason reason) {
    }
}
