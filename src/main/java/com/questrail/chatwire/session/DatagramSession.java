package com.questrail.chatwire.session;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.internal.time.OwnedScheduler;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.protocol.reliable.PendingSend;
import com.questrail.chatwire.protocol.reliable.ReliableDatagramChannel;
import com.questrail.chatwire.protocol.reliable.ReliableTransportContext;
import com.questrail.chatwire.transport.DatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntSupplier;

/**
 * DatagramSession
 * =============================================================================
 * One datagram peer, keyed by source address.
 *
 * <h2>Threading</h2>
 * Inbound datagrams are handed to {@link #onDatagram(byte[])} synchronously by
 * the server's single receive loop; no thread is started per datagram. The
 * session's retry loop runs on its own {@link OwnedScheduler}. In production
 * that is a {@code DedicatedThreadScheduler}, whose thread starts with the
 * first reliable send and exits about a second after the last one is
 * acknowledged.
 *
 * <h2>Reliability</h2>
 * Outbound chat goes through a {@link ReliableDatagramChannel}; every other
 * kind is a single datagram. A chat send that exhausts its retries closes the
 * session with {@link CloseReason#RETRIES_EXHAUSTED}.
 */
public final class DatagramSession extends AbstractSession
{
    private static final Logger log = LoggerFactory.getLogger(DatagramSession.class);

    private final OwnedScheduler retryScheduler;
    private final ReliableDatagramChannel channel;
    private final IntSupplier connectedPeers;

    /**
     * @param remote         the peer's source address
     * @param endpoint       the server's shared datagram endpoint
     * @param reliable       reliability collaborators
     * @param retryScheduler scheduler owned by this session, closed on teardown
     * @param connectedPeers current number of peers, quoted in the welcome notice
     */
    public DatagramSession(SocketAddress remote,
                           DatagramEndpoint endpoint,
                           SessionContext context,
                           ReliableTransportContext reliable,
                           OwnedScheduler retryScheduler,
                           IntSupplier connectedPeers)
    {
        super(new PeerRecord(
                remote,
                TransportProtocol.DATAGRAM,
                context.wallClock().now(),
                context.clock().nowNanos()), context);

        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler");
        this.connectedPeers = Objects.requireNonNull(connectedPeers, "connectedPeers");
        this.channel = new ReliableDatagramChannel(
                identifier(),
                context.config().serverIdentity(),
                remote,
                endpoint,
                reliable,
                retryScheduler,
                this::onRetriesExhausted);
    }

    /**
     * Handles one datagram from this peer. Called on the receive loop.
     */
    public void onDatagram(byte[] payload)
    {
        onPayload(payload);
    }

    public ReliableDatagramChannel channel()
    {
        return channel;
    }

    /**
     * Waits for this session's retry thread to exit after teardown.
     */
    public boolean awaitRetryThread(Duration timeout) throws InterruptedException
    {
        return retryScheduler.awaitTermination(timeout);
    }

    @Override
    protected Optional<ChatMessage> admit(ChatMessage message)
    {
        return channel.accept(message);
    }

    @Override
    protected void onConnectAccepted(boolean firstConnect)
    {
        // Also the reply that satisfies the client's reachability probe.
        send(serverMessage(MessageKind.STATUS, "Welcome " + displayName()
                + "! You are connected via UDP. There are " + connectedPeers.getAsInt()
                + " clients online."));
    }

    @Override
    protected void transmit(ChatMessage message)
    {
        if (message.kind() == MessageKind.CHAT) {
            try {
                channel.sendChat(message);
            }
            catch (IllegalStateException e) {
                // Lost a race with close(); pending sends are discarded anyway.
                log.debug("Peer {}: chat dropped, session closing", identifier());
            }
        }
        else {
            channel.sendUnreliable(message);
        }
    }

    @Override
    protected void releaseTransport(CloseReason reason)
    {
        int discarded = channel.sender().pendingCount();
        channel.close();
        retryScheduler.close();
        if (discarded > 0) {
            log.debug("Peer {}: {} unacknowledged sends discarded", identifier(), discarded);
        }
        if (reason == CloseReason.SERVER_STOPPED) {
            channel.sendUnreliable(serverMessage(MessageKind.DISCONNECT, ""));
        }
    }

    private void onRetriesExhausted(PendingSend abandoned)
    {
        log.warn("Peer {}: giving up on sequence {}", identifier(), abandoned.sequence());
        close(CloseReason.RETRIES_EXHAUSTED);
    }
}
