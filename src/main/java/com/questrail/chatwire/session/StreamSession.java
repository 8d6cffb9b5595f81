package com.questrail.chatwire.session;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.observability.ChatErrorEvent;
import com.questrail.chatwire.protocol.codec.stream.FrameTooLargeException;
import com.questrail.chatwire.protocol.codec.stream.StreamFrameReader;
import com.questrail.chatwire.protocol.codec.stream.StreamFramer;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.transport.SendFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * StreamSession
 * =============================================================================
 * One TCP connection. {@link #run()} is the connection's read loop and runs on
 * a thread of its own.
 *
 * <p>The socket has a short read timeout so the loop observes both its own
 * state and the server's running flag promptly. Writes may come from any
 * thread (echo from the read loop, server sends, broadcasts) and are
 * serialized per connection.</p>
 */
public final class StreamSession extends AbstractSession implements Runnable
{
    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private final Socket socket;
    private final StreamFrameReader reader;
    private final OutputStream out;
    private final BooleanSupplier serverRunning;
    private final Object writeLock = new Object();

    /**
     * @param socket        a connected (and already decorated) socket
     * @param serverRunning the owning server's running flag
     * @throws IOException if the socket's streams cannot be opened
     */
    public StreamSession(Socket socket, SessionContext context, BooleanSupplier serverRunning) throws IOException
    {
        super(new PeerRecord(
                socket.getRemoteSocketAddress(),
                TransportProtocol.STREAM,
                context.wallClock().now(),
                context.clock().nowNanos()), context);

        this.socket = socket;
        this.serverRunning = Objects.requireNonNull(serverRunning, "serverRunning");

        socket.setSoTimeout((int) context.config().readTimeout().toMillis());
        socket.setTcpNoDelay(true);
        this.reader = new StreamFrameReader(socket.getInputStream(), new StreamFramer());
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    @Override
    public void run()
    {
        send(systemNotice("Welcome! Your username: " + displayName()));

        CloseReason reason = null;
        try {
            while (reason == null && isOpen() && serverRunning.getAsBoolean()) {
                StreamFrameReader.ReadResult result = reader.read();
                if (result instanceof StreamFrameReader.Frames frames) {
                    for (byte[] payload : frames.payloads()) {
                        onPayload(payload);
                        if (!isOpen()) {
                            break;
                        }
                    }
                }
                else if (result instanceof StreamFrameReader.PeerClosed) {
                    log.info("Peer {} closed the connection", identifier());
                    reason = CloseReason.PEER_CLOSED;
                }
                // Idle: loop around and re-check the flags.
            }
        }
        catch (FrameTooLargeException e) {
            log.warn("Peer {}: {}", identifier(), e.getMessage());
            context.observability().onError(new ChatErrorEvent(
                    context.wallClock().now(), identifier(), "Oversized frame", e));
            reason = CloseReason.FRAME_TOO_LARGE;
        }
        catch (IOException e) {
            if (isOpen()) {
                log.warn("Peer {}: connection reset: {}", identifier(), e.toString());
            }
            reason = CloseReason.TRANSPORT_RESET;
        }
        catch (RuntimeException e) {
            log.error("Peer {}: handler failed", identifier(), e);
            context.observability().onError(new ChatErrorEvent(
                    context.wallClock().now(), identifier(), "Handler failure", e));
            context.callbacks().status().onStatus("Client handler error: " + e.getMessage(), true);
            reason = CloseReason.TRANSPORT_RESET;
        }
        finally {
            // No-op if the session already closed itself.
            close(reason != null ? reason : CloseReason.SERVER_STOPPED);
        }
    }

    @Override
    protected void transmit(ChatMessage message) throws FrameTooLargeException, SendFailureException
    {
        byte[] frame = StreamFramer.frame(context.codec().encode(message));
        try {
            synchronized (writeLock) {
                out.write(frame);
                out.flush();
            }
        }
        catch (IOException e) {
            throw new SendFailureException("Send to " + identifier() + " failed", e);
        }
    }

    @Override
    protected void releaseTransport(CloseReason reason)
    {
        if (reason == CloseReason.SERVER_STOPPED) {
            // Best effort; the socket closes either way.
            try {
                transmit(serverMessage(MessageKind.DISCONNECT, ""));
            }
            catch (FrameTooLargeException | SendFailureException e) {
                log.debug("Peer {}: goodbye not delivered", identifier(), e);
            }
        }
        try {
            socket.close();
        }
        catch (IOException e) {
            log.debug("Peer {}: error closing socket", identifier(), e);
        }
    }
}
