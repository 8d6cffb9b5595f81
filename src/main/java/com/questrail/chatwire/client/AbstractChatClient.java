package com.questrail.chatwire.client;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.config.ClientConfig;
import com.questrail.chatwire.internal.time.WallClock;
import com.questrail.chatwire.observability.ChatErrorEvent;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.protocol.codec.stream.FrameTooLargeException;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.transport.PeerUnreachableException;
import com.questrail.chatwire.transport.SendFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AbstractChatClient
 * =============================================================================
 * Transport-independent client behavior: connect/disconnect skeleton, outbound
 * message construction, inbound dispatch and latency measurement.
 *
 * <h2>Teardown</h2>
 * Exactly one of {@link #disconnect()} or {@link #connectionLost(CloseReason)}
 * releases the transport for a given connection; the other becomes a no-op.
 */
public abstract class AbstractChatClient implements ChatClient
{
    private static final Logger log = LoggerFactory.getLogger(AbstractChatClient.class);

    protected final ClientConfig config;
    protected final ChatClientListener listener;
    protected final WireCodec codec;
    protected final WallClock wallClock;
    protected final ChatObservabilitySink observability;

    private final AtomicBoolean connecting = new AtomicBoolean(false);
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private volatile String displayName;

    protected AbstractChatClient(ClientConfig config,
                                 ChatClientListener listener,
                                 WireCodec codec,
                                 WallClock wallClock,
                                 ChatObservabilitySink observability)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    // -------------------------------------------------------------------------
    // Transport hooks
    // -------------------------------------------------------------------------

    /**
     * Opens the transport, announces {@code name} and, for datagrams, waits for
     * the reachability probe's reply. Must release everything it opened before
     * throwing.
     */
    protected abstract void openTransport(String name) throws PeerUnreachableException;

    /**
     * Starts the receive loop, if the transport needs one. Called once the
     * client counts as connected.
     */
    protected void startReceiving() {
    }

    /**
     * @throws FrameTooLargeException if the encoded message cannot be framed;
     *         nothing was written and the connection is still usable
     */
    protected abstract void transmit(ChatMessage message) throws FrameTooLargeException, SendFailureException;

    /**
     * Releases sockets and threads. Must not throw.
     */
    protected abstract void releaseTransport();

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public final void connect(String name) throws PeerUnreachableException
    {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("display name must not be blank");
        }
        if (!connecting.compareAndSet(false, true)) {
            throw new IllegalStateException("Already connected or connecting");
        }

        displayName = name.strip();
        try {
            openTransport(displayName);
        }
        catch (PeerUnreachableException | RuntimeException e) {
            connecting.set(false);
            throw e;
        }

        connected.set(true);
        startReceiving();
        log.info("Connected to {} ({}) as '{}'", config.serverAddress(), protocol(), displayName);
    }

    @Override
    public final void disconnect()
    {
        if (!connected.compareAndSet(true, false)) {
            return;
        }

        try {
            transmit(message(MessageKind.DISCONNECT, ""));
        }
        catch (FrameTooLargeException | SendFailureException e) {
            log.debug("Disconnect notice not delivered", e);
        }

        releaseTransport();
        connecting.set(false);
        log.info("Disconnected from {}", config.serverAddress());
    }

    /**
     * Tears the connection down because of something the server or the
     * network did. Notifies the listener once.
     */
    protected final void connectionLost(CloseReason reason)
    {
        if (!connected.compareAndSet(true, false)) {
            return;
        }

        if (reason.isConnectionLost()) {
            log.warn("Connection to {} lost: {}", config.serverAddress(), reason);
        }
        else {
            log.info("Connection to {} closed: {}", config.serverAddress(), reason);
        }

        releaseTransport();
        connecting.set(false);
        listener.onDisconnected(reason);
    }

    @Override
    public final boolean isConnected()
    {
        return connected.get();
    }

    @Override
    public final String displayName()
    {
        return displayName;
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    @Override
    public boolean send(String text)
    {
        return transmitIfConnected(message(MessageKind.CHAT, Objects.requireNonNull(text, "text")));
    }

    @Override
    public boolean sendStatus(String text)
    {
        return transmitIfConnected(message(MessageKind.STATUS, Objects.requireNonNull(text, "text")));
    }

    @Override
    public boolean sendTest()
    {
        return transmitIfConnected(message(MessageKind.TEST, ""));
    }

    protected final ChatMessage message(MessageKind kind, String content)
    {
        return ChatMessage.of(kind, content, displayName, wallClock.now());
    }

    private boolean transmitIfConnected(ChatMessage message)
    {
        if (!connected.get()) {
            return false;
        }
        try {
            transmit(message);
            return true;
        }
        catch (FrameTooLargeException e) {
            log.warn("{} not sent: {}", message.kind(), e.getMessage());
            return false;
        }
        catch (SendFailureException e) {
            observability.onError(new ChatErrorEvent(wallClock.now(), null, "Send failed", e));
            connectionLost(CloseReason.SEND_FAILURE);
            return false;
        }
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Dispatches one decoded message from the server.
     */
    protected final void onInbound(ChatMessage message)
    {
        switch (message.kind()) {
            case TEST:
                // Never echoed back; that would ping-pong forever.
                listener.onLatency(latencyOf(message));
                break;
            case DISCONNECT:
                connectionLost(CloseReason.PEER_DISCONNECTED);
                break;
            case ACK:
                break;
            case CONNECT:
            case CHAT:
            case STATUS:
            case ERROR:
                listener.onMessage(message);
                break;
        }
    }

    private Duration latencyOf(ChatMessage echo)
    {
        double seconds = ChatMessage.epochSeconds(wallClock.now()) - echo.timestamp();
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }
}
