package com.questrail.chatwire.server;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.PeerInfo;
import com.questrail.chatwire.api.ServerCallbacks;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.config.ServerConfig;
import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.WallClock;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.session.AbstractSession;
import com.questrail.chatwire.session.PeerRegistry;
import com.questrail.chatwire.session.SessionContext;
import com.questrail.chatwire.session.SessionOwner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * AbstractChatServer
 * =============================================================================
 * Transport-independent server behavior: the peer registry, the server send
 * API, presence announcements and the start/stop skeleton.
 *
 * <h2>Shutdown order</h2>
 * <ol>
 *   <li>clear the running flag (every loop polls it)</li>
 *   <li>close every session with {@link CloseReason#SERVER_STOPPED}</li>
 *   <li>release the transport ({@link #stopTransport()})</li>
 *   <li>join worker threads, bounded by
 *       {@link ServerConfig#shutdownTimeout()} ({@link #awaitWorkers(List, long)})</li>
 * </ol>
 *
 * @param <S> session type
 */
public abstract class AbstractChatServer<S extends AbstractSession> implements ChatServer, SessionOwner
{
    private static final Logger log = LoggerFactory.getLogger(AbstractChatServer.class);

    protected final ServerConfig config;
    protected final ServerCallbacks callbacks;
    protected final MonotonicClock clock;
    protected final WallClock wallClock;
    protected final ChatObservabilitySink observability;
    protected final PeerRegistry<S> registry = new PeerRegistry<>();
    protected final SessionContext sessionContext;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    protected final AtomicBoolean running = new AtomicBoolean(false);

    protected AbstractChatServer(ServerConfig config,
                                 ServerCallbacks callbacks,
                                 WireCodec codec,
                                 MonotonicClock clock,
                                 WallClock wallClock,
                                 ChatObservabilitySink observability)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.sessionContext = new SessionContext(
                config, callbacks, Objects.requireNonNull(codec, "codec"),
                clock, wallClock, observability, registry, this);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public final void start() throws IOException
    {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }

        try {
            startTransport();
        }
        catch (IOException e) {
            stopped.set(true);
            log.error("Failed to start {} server on {}", protocol(), config.bindAddress(), e);
            callbacks.status().onStatus("Failed to start server: " + e.getMessage(), true);
            throw e;
        }

        log.info("{} server listening on {}", protocol(), localAddress());
        callbacks.status().onStatus("Server started on " + hostPort(localAddress()), false);
    }

    @Override
    public final void stop()
    {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }

        final long deadline = clock.nowNanos() + config.shutdownTimeout().toNanos();
        running.set(false);

        List<S> closed = closeAllSessions(CloseReason.SERVER_STOPPED);
        stopTransport();

        try {
            awaitWorkers(closed, deadline);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} server threads", protocol());
        }

        log.info("{} server stopped", protocol());
        callbacks.status().onStatus("Server stopped", false);
    }

    /**
     * Binds the transport and starts its loops. Sets {@link #running} once
     * the transport is usable.
     */
    protected abstract void startTransport() throws IOException;

    /**
     * Unblocks and releases the transport. Must not throw.
     */
    protected abstract void stopTransport();

    /**
     * Joins worker threads until {@code deadlineNanos} on {@link #clock}.
     *
     * @param closedSessions sessions closed by this stop
     */
    protected abstract void awaitWorkers(List<S> closedSessions, long deadlineNanos) throws InterruptedException;

    /**
     * @return the sessions that were registered and have now been closed
     */
    protected final List<S> closeAllSessions(CloseReason reason)
    {
        List<S> sessions = registry.snapshot();
        for (S session : sessions) {
            session.close(reason);
        }
        return sessions;
    }

    // -------------------------------------------------------------------------
    // Server send API
    // -------------------------------------------------------------------------

    @Override
    public boolean send(String peerIdentifier, String text)
    {
        Objects.requireNonNull(peerIdentifier, "peerIdentifier");
        Objects.requireNonNull(text, "text");

        return registry.find(peerIdentifier)
                .filter(AbstractSession::isOpen)
                .map(s -> s.send(s.serverMessage(MessageKind.CHAT, text)))
                .orElse(false);
    }

    @Override
    public int broadcast(String text)
    {
        Objects.requireNonNull(text, "text");

        int reached = 0;
        for (S session : registry.snapshot()) {
            if (session.isOpen() && session.send(session.serverMessage(MessageKind.CHAT, text))) {
                reached++;
            }
        }
        return reached;
    }

    @Override
    public List<PeerInfo> peers()
    {
        return registry.snapshot().stream()
                .map(AbstractSession::peerInfo)
                .collect(Collectors.toList());
    }

    @Override
    public int peerCount()
    {
        return registry.size();
    }

    @Override
    public boolean isRunning()
    {
        return running.get();
    }

    @Override
    public String statusLine()
    {
        SocketAddress local = localAddress();
        if (!running.get() || local == null) {
            return "Stopped";
        }
        return "Running on " + hostPort(local) + " - Clients: " + peerCount();
    }

    // -------------------------------------------------------------------------
    // Presence
    // -------------------------------------------------------------------------

    @Override
    public void peerJoined(AbstractSession session)
    {
        announce(session.displayName() + " joined the chat", session);
    }

    @Override
    public void peerLeft(AbstractSession session, CloseReason reason)
    {
        if (reason == CloseReason.SERVER_STOPPED) {
            return;
        }
        String text = reason == CloseReason.INACTIVITY_TIMEOUT
                ? session.displayName() + " timed out (inactive)"
                : session.displayName() + " left the chat";
        announce(text, session);
    }

    private void announce(String text, AbstractSession subject)
    {
        if (!config.announcePresence()) {
            return;
        }
        for (S other : registry.snapshot()) {
            if (other != subject && other.isActive()) {
                other.send(other.serverMessage(MessageKind.STATUS, text));
            }
        }
    }

    protected static String hostPort(SocketAddress address)
    {
        if (address instanceof InetSocketAddress inet) {
            return inet.getHostString() + ":" + inet.getPort();
        }
        return String.valueOf(address);
    }

    @Override
    public abstract TransportProtocol protocol();
}
