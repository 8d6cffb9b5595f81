package com.questrail.chatwire.client;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.config.ClientConfig;
import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.OwnedScheduler;
import com.questrail.chatwire.internal.time.SchedulerFactory;
import com.questrail.chatwire.internal.time.WallClock;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.MessageDecodeException;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.protocol.reliable.EnvelopeCodec;
import com.questrail.chatwire.protocol.reliable.ReliableDatagramChannel;
import com.questrail.chatwire.protocol.reliable.ReliableTransportContext;
import com.questrail.chatwire.session.PeerRecord;
import com.questrail.chatwire.transport.DatagramEndpoint;
import com.questrail.chatwire.transport.DatagramEndpointListener;
import com.questrail.chatwire.transport.PeerUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * DatagramChatClient
 * =============================================================================
 * UDP chat client.
 *
 * <h2>Reachability probe</h2>
 * UDP gives no connection feedback, so {@link #connect(String)} sends a Connect
 * and waits up to {@link ClientConfig#probeTimeout()} for any datagram from the
 * server. Silence fails the connect with {@link PeerUnreachableException}.
 *
 * <h2>Resources</h2>
 * Each connection opens a fresh {@link DatagramEndpoint} from the supplied
 * factory (an ephemeral local port) and a retry scheduler; both are released
 * on disconnect or connection loss.
 *
 * <p>Datagrams from any address other than the server are ignored.</p>
 */
public final class DatagramChatClient extends AbstractChatClient
{
    private static final Logger log = LoggerFactory.getLogger(DatagramChatClient.class);

    private final Supplier<DatagramEndpoint> endpoints;
    private final SchedulerFactory schedulers;
    private final ReliableTransportContext reliable;
    private final InetSocketAddress server;
    private final String serverIdentifier;

    private volatile DatagramEndpoint endpoint;
    private volatile OwnedScheduler retryScheduler;
    private volatile ReliableDatagramChannel channel;
    private volatile CountDownLatch probeReply;

    public DatagramChatClient(ClientConfig config,
                              ChatClientListener listener,
                              WireCodec codec,
                              Supplier<DatagramEndpoint> endpoints,
                              MonotonicClock clock,
                              WallClock wallClock,
                              SchedulerFactory schedulers,
                              ChatObservabilitySink observability)
    {
        super(config, listener, codec, wallClock, observability);
        if (config.protocol() != TransportProtocol.DATAGRAM) {
            throw new IllegalArgumentException("Datagram client needs a DATAGRAM config, got " + config.protocol());
        }
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.schedulers = Objects.requireNonNull(schedulers, "schedulers");
        this.reliable = new ReliableTransportContext(
                codec, new EnvelopeCodec(), config.reliability(), clock, wallClock, observability);

        InetSocketAddress configured = config.serverAddress();
        this.server = configured.isUnresolved()
                ? new InetSocketAddress(configured.getHostString(), configured.getPort())
                : configured;
        this.serverIdentifier = PeerRecord.identifierOf(server);
    }

    @Override
    public TransportProtocol protocol()
    {
        return TransportProtocol.DATAGRAM;
    }

    /**
     * The reliable channel to the server while connected, for inspection.
     */
    public Optional<ReliableDatagramChannel> channel()
    {
        return Optional.ofNullable(channel);
    }

    @Override
    protected void openTransport(String name) throws PeerUnreachableException
    {
        if (server.isUnresolved()) {
            throw new PeerUnreachableException(server, "Cannot resolve server host");
        }

        CountDownLatch up = new CountDownLatch(1);
        CountDownLatch reply = new CountDownLatch(1);
        probeReply = reply;

        DatagramEndpoint ep = endpoints.get();
        endpoint = ep;
        ep.setListener(new EndpointListener(up));
        ep.start();

        try {
            if (!up.await(config.probeTimeout().toMillis(), TimeUnit.MILLISECONDS) || ep.localAddress() == null) {
                releaseTransport();
                throw new PeerUnreachableException(server, "Cannot open local UDP socket");
            }

            OwnedScheduler scheduler = schedulers.open("chatwire-udp-client-retry");
            retryScheduler = scheduler;
            channel = new ReliableDatagramChannel(
                    serverIdentifier,
                    name,
                    server,
                    ep,
                    reliable,
                    scheduler,
                    abandoned -> connectionLost(CloseReason.RETRIES_EXHAUSTED));

            log.debug("Probing {} from {}", server, ep.localAddress());
            channel.sendUnreliable(ChatMessage.of(MessageKind.CONNECT, name, name, wallClock.now()));

            if (!reply.await(config.probeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                releaseTransport();
                throw new PeerUnreachableException(server, "No reply to connect probe");
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseTransport();
            throw new PeerUnreachableException(server, "Interrupted while probing", e);
        }
    }

    @Override
    protected void transmit(ChatMessage message)
    {
        ReliableDatagramChannel ch = channel;
        if (ch == null) {
            return;
        }
        if (message.kind() == MessageKind.CHAT) {
            try {
                ch.sendChat(message);
            }
            catch (IllegalStateException e) {
                log.debug("Chat dropped, connection closing");
            }
        }
        else {
            ch.sendUnreliable(message);
        }
    }

    @Override
    protected void releaseTransport()
    {
        ReliableDatagramChannel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }

        OwnedScheduler scheduler = retryScheduler;
        retryScheduler = null;
        if (scheduler != null) {
            scheduler.close();
        }

        DatagramEndpoint ep = endpoint;
        endpoint = null;
        if (ep != null) {
            ep.stop();
        }
    }

    private void onDatagram(SocketAddress remote, byte[] payload)
    {
        if (!server.equals(remote)) {
            log.debug("Ignoring datagram from {}", remote);
            return;
        }

        CountDownLatch reply = probeReply;
        if (reply != null) {
            reply.countDown();
        }

        ReliableDatagramChannel ch = channel;
        if (ch == null) {
            return;
        }

        final Optional<ChatMessage> admitted;
        try {
            admitted = ch.accept(codec.decode(payload));
        }
        catch (MessageDecodeException e) {
            log.warn("Dropped undecodable datagram from server: {}", e.getMessage());
            return;
        }
        admitted.ifPresent(this::onInbound);
    }

    private final class EndpointListener implements DatagramEndpointListener
    {
        private final CountDownLatch up;

        EndpointListener(CountDownLatch up)
        {
            this.up = up;
        }

        @Override
        public void onTransportUp()
        {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            up.countDown();
            if (cause != null) {
                log.warn("UDP transport failed", cause);
                connectionLost(CloseReason.TRANSPORT_RESET);
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            DatagramChatClient.this.onDatagram(remote, payload);
        }
    }
}
