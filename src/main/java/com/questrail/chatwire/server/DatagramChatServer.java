package com.questrail.chatwire.server;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.ServerCallbacks;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.config.ServerConfig;
import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.OwnedScheduler;
import com.questrail.chatwire.internal.time.SchedulerFactory;
import com.questrail.chatwire.internal.time.WallClock;
import com.questrail.chatwire.observability.ChatErrorEvent;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.protocol.reliable.EnvelopeCodec;
import com.questrail.chatwire.protocol.reliable.ReliableTransportContext;
import com.questrail.chatwire.session.DatagramSession;
import com.questrail.chatwire.session.PeerRecord;
import com.questrail.chatwire.transport.DatagramEndpoint;
import com.questrail.chatwire.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * DatagramChatServer
 * =============================================================================
 * UDP chat server over a {@link DatagramEndpoint}.
 *
 * <h2>Receive path</h2>
 * The endpoint delivers every datagram on one thread. Each datagram is
 * classified by source address; the matching {@link DatagramSession} is looked
 * up, or created on first contact, and handed the datagram synchronously.
 *
 * <h2>Reaper</h2>
 * Every {@link ServerConfig#reaperInterval()} a reaper closes sessions silent
 * for longer than {@link ServerConfig#inactivityTimeout()} with
 * {@link CloseReason#INACTIVITY_TIMEOUT}. Activity is measured on the
 * monotonic clock.
 *
 * <h2>Transport loss</h2>
 * If the endpoint goes down while the server runs, every session is closed
 * with {@link CloseReason#TRANSPORT_RESET} and the server stops serving.
 */
public final class DatagramChatServer extends AbstractChatServer<DatagramSession>
{
    private static final Logger log = LoggerFactory.getLogger(DatagramChatServer.class);

    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(5);

    private final DatagramEndpoint endpoint;
    private final SchedulerFactory schedulers;
    private final ReliableTransportContext reliable;

    private final CountDownLatch transportUp = new CountDownLatch(1);
    private final AtomicReference<Throwable> bindFailure = new AtomicReference<>();

    private volatile OwnedScheduler reaper;

    public DatagramChatServer(ServerConfig config,
                              ServerCallbacks callbacks,
                              WireCodec codec,
                              DatagramEndpoint endpoint,
                              MonotonicClock clock,
                              WallClock wallClock,
                              SchedulerFactory schedulers,
                              ChatObservabilitySink observability)
    {
        super(config, callbacks, codec, clock, wallClock, observability);
        if (config.protocol() != TransportProtocol.DATAGRAM) {
            throw new IllegalArgumentException("Datagram server needs a DATAGRAM config, got " + config.protocol());
        }
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.schedulers = Objects.requireNonNull(schedulers, "schedulers");
        this.reliable = new ReliableTransportContext(
                codec, new EnvelopeCodec(), config.reliability(), clock, wallClock, observability);
    }

    @Override
    public TransportProtocol protocol()
    {
        return TransportProtocol.DATAGRAM;
    }

    @Override
    public SocketAddress localAddress()
    {
        return endpoint.localAddress();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    protected void startTransport() throws IOException
    {
        endpoint.setListener(new EndpointListener());
        endpoint.start();

        final boolean settled;
        try {
            settled = transportUp.await(BIND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            endpoint.stop();
            throw new IOException("Interrupted while binding " + config.bindAddress(), e);
        }

        Throwable failure = bindFailure.get();
        if (!settled || failure != null) {
            endpoint.stop();
            String why = failure != null ? String.valueOf(failure.getMessage()) : "timed out";
            throw new IOException("Cannot bind UDP " + config.bindAddress() + ": " + why, failure);
        }

        reaper = schedulers.open("chatwire-udp-reaper");
        armReaper();
    }

    @Override
    protected void stopTransport()
    {
        OwnedScheduler r = reaper;
        if (r != null) {
            r.close();
        }
        endpoint.stop();
    }

    @Override
    protected void awaitWorkers(List<DatagramSession> closedSessions, long deadlineNanos) throws InterruptedException
    {
        OwnedScheduler r = reaper;
        if (r != null) {
            r.awaitTermination(remaining(deadlineNanos));
        }

        for (DatagramSession session : closedSessions) {
            if (!session.awaitRetryThread(remaining(deadlineNanos))) {
                log.warn("Retry thread for {} still running after shutdown timeout", session.identifier());
            }
        }
    }

    private Duration remaining(long deadlineNanos)
    {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - clock.nowNanos()));
    }

    // -------------------------------------------------------------------------
    // Receive path
    // -------------------------------------------------------------------------

    private void onDatagram(SocketAddress remote, byte[] payload)
    {
        if (!running.get()) {
            return;
        }

        String identifier = PeerRecord.identifierOf(remote);
        DatagramSession session = null;
        try {
            session = registry.lookupOrCreate(identifier, id -> newSession(remote));
            session.onDatagram(payload);
        }
        catch (RuntimeException e) {
            // Fatal to this peer only; the receive loop keeps serving the others.
            log.error("Peer {}: handler failed", identifier, e);
            observability.onError(new ChatErrorEvent(wallClock.now(), identifier, "Handler failure", e));
            callbacks.status().onStatus("Client handler error: " + e.getMessage(), true);
            if (session != null) {
                session.close(CloseReason.TRANSPORT_RESET);
            }
        }
    }

    private DatagramSession newSession(SocketAddress remote)
    {
        String identifier = PeerRecord.identifierOf(remote);
        log.info("New datagram peer {}", identifier);
        return new DatagramSession(
                remote,
                endpoint,
                sessionContext,
                reliable,
                schedulers.open("chatwire-peer-" + identifier),
                registry::size);
    }

    // -------------------------------------------------------------------------
    // Reaper
    // -------------------------------------------------------------------------

    private void armReaper()
    {
        OwnedScheduler r = reaper;
        if (r == null || !running.get()) {
            return;
        }
        r.scheduleAfter(config.reaperInterval(), clock, () -> {
            try {
                reapStalePeers();
            }
            catch (RuntimeException e) {
                log.error("Reaper pass failed", e);
                observability.onError(new ChatErrorEvent(wallClock.now(), null, "Reaper pass failed", e));
            }
            finally {
                armReaper();
            }
        });
    }

    /**
     * Closes every session idle for at least the inactivity timeout.
     *
     * @return number of sessions closed
     */
    public int reapStalePeers()
    {
        if (!running.get()) {
            return 0;
        }

        final long now = clock.nowNanos();
        final long timeout = config.inactivityTimeout().toNanos();

        int reaped = 0;
        for (DatagramSession session : registry.snapshot()) {
            if (now - session.record().lastActivityNanos() >= timeout) {
                log.info("Reaping inactive peer {} ({})", session.identifier(), session.displayName());
                session.close(CloseReason.INACTIVITY_TIMEOUT);
                reaped++;
            }
        }
        return reaped;
    }

    // -------------------------------------------------------------------------

    private void onTransportLost(Throwable cause)
    {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.error("UDP transport lost", cause);
        observability.onError(new ChatErrorEvent(wallClock.now(), null, "Transport lost", cause));
        callbacks.status().onStatus("Transport lost: " + (cause != null ? cause.getMessage() : "closed"), true);
        closeAllSessions(CloseReason.TRANSPORT_RESET);
    }

    private final class EndpointListener implements DatagramEndpointListener
    {
        @Override
        public void onTransportUp()
        {
            running.set(true);
            transportUp.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            if (transportUp.getCount() > 0) {
                bindFailure.compareAndSet(null, cause != null ? cause : new IOException("Transport closed"));
                transportUp.countDown();
                return;
            }
            onTransportLost(cause);
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            DatagramChatServer.this.onDatagram(remote, payload);
        }
    }
}
