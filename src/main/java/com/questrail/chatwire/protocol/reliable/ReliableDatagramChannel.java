package com.questrail.chatwire.protocol.reliable;

import com.questrail.chatwire.internal.time.MonotonicScheduler;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.transport.DatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * ReliableDatagramChannel
 * =============================================================================
 * Both halves of the reliable datagram layer for one remote peer: a
 * {@link ReliableDatagramSender} for outbound chat and the receiver-side
 * acknowledgement and duplicate suppression for inbound chat.
 *
 * <h2>Inbound classification ({@link #accept(ChatMessage)})</h2>
 * <ul>
 *   <li>{@code ack}: settles the matching pending send; never surfaces.</li>
 *   <li>{@code message} with an envelope: acknowledged immediately (every copy,
 *       so a lost acknowledgement is repaired by the next retransmission), then
 *       surfaced with the envelope's data, once per sequence number.</li>
 *   <li>{@code message} without an envelope: surfaced unchanged, not acknowledged.</li>
 *   <li>every other kind: surfaced unchanged. {@code test} in particular never
 *       carries an envelope.</li>
 * </ul>
 */
public final class ReliableDatagramChannel
{
    private static final Logger log = LoggerFactory.getLogger(ReliableDatagramChannel.class);

    private final String peerIdentifier;
    private final String localIdentity;
    private final SocketAddress remote;
    private final DatagramEndpoint endpoint;
    private final ReliableTransportContext context;
    private final ReliableDatagramSender sender;
    private final SequenceWindow seen;

    /**
     * @param peerIdentifier     identifier of the remote peer, for logs and events
     * @param localIdentity      sender name stamped on acknowledgements
     * @param remote             remote address every datagram is sent to
     * @param endpoint           shared datagram endpoint
     * @param context            codecs, policy, clocks, observability
     * @param scheduler          scheduler driving this peer's retry loop
     * @param onRetriesExhausted invoked, outside any lock, when a send is abandoned
     */
    public ReliableDatagramChannel(String peerIdentifier,
                                   String localIdentity,
                                   SocketAddress remote,
                                   DatagramEndpoint endpoint,
                                   ReliableTransportContext context,
                                   MonotonicScheduler scheduler,
                                   Consumer<PendingSend> onRetriesExhausted)
    {
        this.peerIdentifier = Objects.requireNonNull(peerIdentifier, "peerIdentifier");
        this.localIdentity = localIdentity;
        this.remote = Objects.requireNonNull(remote, "remote");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.context = Objects.requireNonNull(context, "context");
        this.sender = new ReliableDatagramSender(
                peerIdentifier, remote, endpoint, context, scheduler, onRetriesExhausted);
        this.seen = new SequenceWindow(context.policy().duplicateWindow());
    }

    /**
     * Sends a chat message through the reliability envelope.
     *
     * @return the assigned sequence number
     */
    public long sendChat(ChatMessage chat)
    {
        return sender.send(chat);
    }

    /**
     * Sends a message of any other kind as a single fire-and-forget datagram.
     */
    public void sendUnreliable(ChatMessage message)
    {
        Objects.requireNonNull(message, "message");
        endpoint.send(remote, context.codec().encode(message));
    }

    /**
     * Classifies one decoded inbound message.
     *
     * @return the message to hand to the session, or empty when the reliability
     *         layer consumed it (acknowledgements and duplicate chat)
     * @throws com.questrail.chatwire.protocol.codec.MalformedMessageException
     *         for an acknowledgement whose content is not a valid payload
     */
    public Optional<ChatMessage> accept(ChatMessage inbound)
    {
        Objects.requireNonNull(inbound, "inbound");

        if (inbound.kind() == MessageKind.ACK) {
            sender.onAck(context.envelopes().decodeAck(inbound.content()));
            return Optional.empty();
        }
        if (inbound.kind() != MessageKind.CHAT) {
            return Optional.of(inbound);
        }

        Optional<ReliableEnvelope> envelope = context.envelopes().tryDecodeEnvelope(inbound.content());
        if (envelope.isEmpty()) {
            return Optional.of(inbound);
        }

        ReliableEnvelope env = envelope.get();
        sendAck(env);

        if (!seen.firstSight(env.sequence())) {
            log.debug("Peer {}: duplicate sequence {} suppressed", peerIdentifier, env.sequence());
            return Optional.empty();
        }
        return Optional.of(inbound.withContent(env.data()));
    }

    public ReliableDatagramSender sender()
    {
        return sender;
    }

    /**
     * Discards all pending sends and stops the retry loop.
     */
    public void close()
    {
        sender.close();
    }

    private void sendAck(ReliableEnvelope envelope)
    {
        ChatMessage ack = ChatMessage.of(
                MessageKind.ACK,
                context.envelopes().encodeAck(AckPayload.acknowledging(envelope)),
                localIdentity,
                context.wallClock().now());
        endpoint.send(remote, context.codec().encode(ack));
    }
}
