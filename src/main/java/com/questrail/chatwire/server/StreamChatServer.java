package com.questrail.chatwire.server;

import com.questrail.chatwire.api.ServerCallbacks;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.config.ServerConfig;
import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.WallClock;
import com.questrail.chatwire.observability.ChatErrorEvent;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.session.StreamSession;
import com.questrail.chatwire.transport.SocketDecorator;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * StreamChatServer
 * =============================================================================
 * TCP chat server.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>One accept thread, blocking in {@code accept()} for at most
 *       {@link ServerConfig#acceptPollInterval()} between checks of the running
 *       flag. Closing the listening socket unblocks it immediately.</li>
 *   <li>One handler thread per connection running {@link StreamSession#run()}.</li>
 * </ul>
 */
public final class StreamChatServer extends AbstractChatServer<StreamSession>
{
    private static final Logger log = LoggerFactory.getLogger(StreamChatServer.class);

    private final SocketDecorator decorator;
    private final ThreadFactory acceptThreads = new DefaultThreadFactory("chatwire-tcp-accept", true);
    private final ThreadFactory sessionThreads = new DefaultThreadFactory("chatwire-tcp-session", true);
    private final Set<Thread> handlerThreads = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private volatile Thread acceptThread;

    public StreamChatServer(ServerConfig config,
                            ServerCallbacks callbacks,
                            WireCodec codec,
                            SocketDecorator decorator,
                            MonotonicClock clock,
                            WallClock wallClock,
                            ChatObservabilitySink observability)
    {
        super(config, callbacks, codec, clock, wallClock, observability);
        this.decorator = Objects.requireNonNull(decorator, "decorator");
        if (config.protocol() != TransportProtocol.STREAM) {
            throw new IllegalArgumentException("Stream server needs a STREAM config, got " + config.protocol());
        }
    }

    @Override
    public TransportProtocol protocol()
    {
        return TransportProtocol.STREAM;
    }

    @Override
    public SocketAddress localAddress()
    {
        ServerSocket ss = serverSocket;
        return ss != null && ss.isBound() && !ss.isClosed() ? ss.getLocalSocketAddress() : null;
    }

    @Override
    protected void startTransport() throws IOException
    {
        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(config.bindAddress());
            ss.setSoTimeout((int) config.acceptPollInterval().toMillis());
        }
        catch (IOException e) {
            closeQuietly(ss);
            throw e;
        }

        serverSocket = ss;
        running.set(true);

        Thread t = acceptThreads.newThread(this::acceptLoop);
        acceptThread = t;
        t.start();
    }

    private void acceptLoop()
    {
        ServerSocket ss = serverSocket;
        while (running.get()) {
            final Socket accepted;
            try {
                accepted = ss.accept();
            }
            catch (SocketTimeoutException e) {
                continue;
            }
            catch (IOException e) {
                if (running.get()) {
                    log.error("Accept failed on {}", ss.getLocalSocketAddress(), e);
                    callbacks.status().onStatus("Accept failed: " + e.getMessage(), true);
                    observability.onError(new ChatErrorEvent(wallClock.now(), null, "Accept failed", e));
                }
                break;
            }
            handle(accepted);
        }
        log.debug("Accept loop exited");
    }

    private void handle(Socket accepted)
    {
        final StreamSession session;
        try {
            Socket socket = decorator.decorate(accepted, false);
            session = new StreamSession(socket, sessionContext, running::get);
        }
        catch (IOException e) {
            log.warn("Dropping connection from {}: {}", accepted.getRemoteSocketAddress(), e.toString());
            closeQuietly(accepted);
            return;
        }

        if (!registry.register(session)) {
            log.warn("Duplicate peer identifier {}; dropping connection", session.identifier());
            closeQuietly(accepted);
            return;
        }

        log.info("Accepted stream connection from {}", session.identifier());

        Thread t = sessionThreads.newThread(() -> {
            try {
                session.run();
            }
            finally {
                handlerThreads.remove(Thread.currentThread());
            }
        });
        handlerThreads.add(t);
        t.start();
    }

    @Override
    protected void stopTransport()
    {
        ServerSocket ss = serverSocket;
        if (ss != null) {
            closeQuietly(ss);
        }
    }

    @Override
    protected void awaitWorkers(List<StreamSession> closedSessions, long deadlineNanos) throws InterruptedException
    {
        join(acceptThread, deadlineNanos);
        for (Thread t : handlerThreads) {
            join(t, deadlineNanos);
        }
        if (!handlerThreads.isEmpty()) {
            log.warn("{} session threads still running after shutdown timeout", handlerThreads.size());
        }
    }

    private void join(Thread t, long deadlineNanos) throws InterruptedException
    {
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        long remaining = deadlineNanos - clock.nowNanos();
        if (remaining > 0) {
            TimeUnit.NANOSECONDS.timedJoin(t, remaining);
        }
    }

    private static void closeQuietly(AutoCloseable closeable)
    {
        try {
            closeable.close();
        }
        catch (Exception e) {
            log.debug("Error closing {}", closeable, e);
        }
    }
}
