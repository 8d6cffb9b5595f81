package com.questrail.chatwire.client;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.config.ClientConfig;
import com.questrail.chatwire.internal.time.WallClock;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.MessageDecodeException;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.protocol.codec.stream.FrameTooLargeException;
import com.questrail.chatwire.protocol.codec.stream.StreamFrameReader;
import com.questrail.chatwire.protocol.codec.stream.StreamFramer;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.transport.PeerUnreachableException;
import com.questrail.chatwire.transport.SendFailureException;
import com.questrail.chatwire.transport.SocketDecorator;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * StreamChatClient
 * =============================================================================
 * TCP chat client: one socket, one receive thread.
 *
 * <p>{@link #connect(String)} fails with {@link PeerUnreachableException} when
 * the TCP connect does not complete within {@link ClientConfig#connectTimeout()}.</p>
 */
public final class StreamChatClient extends AbstractChatClient
{
    private static final Logger log = LoggerFactory.getLogger(StreamChatClient.class);

    private final SocketDecorator decorator;
    private final ThreadFactory receiveThreads = new DefaultThreadFactory("chatwire-tcp-client", true);
    private final Object writeLock = new Object();

    private volatile Socket socket;
    private volatile OutputStream out;
    private volatile StreamFrameReader reader;
    private volatile Thread receiveThread;

    public StreamChatClient(ClientConfig config,
                            ChatClientListener listener,
                            WireCodec codec,
                            SocketDecorator decorator,
                            WallClock wallClock,
                            ChatObservabilitySink observability)
    {
        super(config, listener, codec, wallClock, observability);
        this.decorator = Objects.requireNonNull(decorator, "decorator");
        if (config.protocol() != TransportProtocol.STREAM) {
            throw new IllegalArgumentException("Stream client needs a STREAM config, got " + config.protocol());
        }
    }

    @Override
    public TransportProtocol protocol()
    {
        return TransportProtocol.STREAM;
    }

    @Override
    protected void openTransport(String name) throws PeerUnreachableException
    {
        Socket plain = new Socket();
        try {
            plain.connect(config.serverAddress(), (int) config.connectTimeout().toMillis());
        }
        catch (IOException e) {
            closeQuietly(plain);
            throw new PeerUnreachableException(config.serverAddress(), "Cannot connect", e);
        }

        try {
            Socket s = decorator.decorate(plain, true);
            s.setSoTimeout((int) config.readTimeout().toMillis());
            s.setTcpNoDelay(true);
            socket = s;
            out = new BufferedOutputStream(s.getOutputStream());
            reader = new StreamFrameReader(s.getInputStream(), new StreamFramer());

            transmit(ChatMessage.of(MessageKind.CONNECT, name, name, wallClock.now()));
        }
        catch (IOException e) {
            releaseTransport();
            closeQuietly(plain);
            throw new PeerUnreachableException(config.serverAddress(), "Handshake failed", e);
        }
    }

    @Override
    protected void startReceiving()
    {
        Thread t = receiveThreads.newThread(this::receiveLoop);
        receiveThread = t;
        t.start();
    }

    private void receiveLoop()
    {
        StreamFrameReader r = reader;
        try {
            while (isConnected()) {
                StreamFrameReader.ReadResult result = r.read();
                if (result instanceof StreamFrameReader.Frames frames) {
                    for (byte[] payload : frames.payloads()) {
                        if (!isConnected()) {
                            return;
                        }
                        deliver(payload);
                    }
                }
                else if (result instanceof StreamFrameReader.PeerClosed) {
                    connectionLost(CloseReason.PEER_CLOSED);
                    return;
                }
            }
        }
        catch (FrameTooLargeException e) {
            log.warn("Server sent an oversized frame: {}", e.getMessage());
            connectionLost(CloseReason.FRAME_TOO_LARGE);
        }
        catch (IOException e) {
            if (isConnected()) {
                log.warn("Receive failed: {}", e.toString());
            }
            connectionLost(CloseReason.TRANSPORT_RESET);
        }
    }

    private void deliver(byte[] payload)
    {
        final ChatMessage message;
        try {
            message = codec.decode(payload);
        }
        catch (MessageDecodeException e) {
            log.warn("Dropped undecodable frame from server: {}", e.getMessage());
            return;
        }
        onInbound(message);
    }

    @Override
    protected void transmit(ChatMessage message) throws FrameTooLargeException, SendFailureException
    {
        OutputStream o = out;
        if (o == null) {
            throw new SendFailureException("Not connected", null);
        }
        byte[] frame = StreamFramer.frame(codec.encode(message));
        try {
            synchronized (writeLock) {
                o.write(frame);
                o.flush();
            }
        }
        catch (IOException e) {
            throw new SendFailureException("Send to " + config.serverAddress() + " failed", e);
        }
    }

    @Override
    protected void releaseTransport()
    {
        Socket s = socket;
        socket = null;
        out = null;
        if (s != null) {
            closeQuietly(s);
        }

        Thread t = receiveThread;
        receiveThread = null;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(config.readTimeout().multipliedBy(2).toMillis());
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void closeQuietly(Socket s)
    {
        try {
            s.close();
        }
        catch (IOException e) {
            log.debug("Error closing socket", e);
        }
    }
}
