package com.questrail.chatwire.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FakeDatagramEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DatagramEndpoint} implementation.
 *
 * <p>Stores outbound datagrams and lets tests inject inbound ones. Holds no
 * chat semantics.</p>
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    public record Sent(SocketAddress remote, byte[] payload) {
        public String text() {
            return new String(payload, StandardCharsets.UTF_8);
        }
    }

    private final SocketAddress localAddress;
    private final List<Sent> sent = new ArrayList<>();

    private volatile DatagramEndpointListener listener;
    private volatile Throwable startFailure;
    private volatile boolean started;

    public FakeDatagramEndpoint(SocketAddress localAddress) {
        this.localAddress = Objects.requireNonNull(localAddress, "localAddress");
    }

    public FakeDatagramEndpoint() {
        this(new InetSocketAddress("127.0.0.1", 5051));
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        DatagramEndpointListener l = listener;
        if (l == null) {
            return;
        }
        if (startFailure != null) {
            l.onTransportDown(startFailure);
            return;
        }
        started = true;
        l.onTransportUp();
    }

    @Override
    public void stop() {
        DatagramEndpointListener l = listener;
        boolean wasStarted = started;
        started = false;
        if (l != null && wasStarted) {
            l.onTransportDown(null);
        }
    }

    @Override
    public synchronized void send(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        sent.add(new Sent(remote, payload));
    }

    @Override
    public SocketAddress localAddress() {
        return localAddress;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Makes the next {@link #start()} report a bind failure instead.
     */
    public void failStartWith(Throwable cause) {
        this.startFailure = cause;
    }

    /**
     * Simulates the socket dying underneath a running endpoint.
     */
    public void failTransport(Throwable cause) {
        DatagramEndpointListener l = listener;
        started = false;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    public void injectDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("No listener installed");
        }
        l.onDatagram(remote, payload);
    }

    public void injectText(SocketAddress remote, String json) {
        injectDatagram(remote, json.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isStarted() {
        return started;
    }

    public synchronized List<Sent> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized List<Sent> sentTo(SocketAddress remote) {
        return sent.stream()
                .filter(s -> s.remote().equals(remote))
                .collect(Collectors.toList());
    }

    public synchronized void clear() {
        sent.clear();
    }
}
