package com.questrail.chatwire.transport.udp.netty;

import com.questrail.chatwire.transport.DatagramEndpoint;
import com.questrail.chatwire.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.PortUnreachableException;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode chat messages</li>
 *   <li>Track peers or sessions</li>
 *   <li>Schedule retries or timeouts</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Threading</h2>
 * A single-threaded {@link NioEventLoopGroup} delivers every listener callback,
 * so that thread is the one datagram receive loop for the whole transport.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the UDP socket and begins receiving datagrams.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 *   The listener hears {@code onTransportDown} once, whichever of stop or
 *   channel inactivity is observed first.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * Construct a Netty UDP endpoint binding to the specified local address.
     *
     * @param bindAddress      local address; port 0 picks an ephemeral port
     * @param maxDatagramBytes largest datagram accepted without truncation
     * @param threadName       name prefix for the event loop thread
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, int maxDatagramBytes, String threadName)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(threadName, "threadName");
        if (maxDatagramBytes <= 0) {
            throw new IllegalArgumentException("maxDatagramBytes must be positive");
        }

        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory(threadName, true));
        this.bootstrap = new Bootstrap();

        // Netty's datagram default receive buffer is 2048 bytes; anything larger
        // would be truncated silently.
        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(maxDatagramBytes))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, int maxDatagramBytes)
    {
        this(bindAddress, maxDatagramBytes, "chatwire-udp");
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        // Bind asynchronously; notify listener on success/failure.
        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                log.info("UDP endpoint bound to {}", channel.localAddress());
                l.onTransportUp();
            }
            else {
                log.warn("UDP bind to {} failed", bindAddress, future.cause());
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ChannelFuture closed = ch.close();
            // Blocking on the event loop itself is not allowed.
            if (!ch.eventLoop().inEventLoop()) {
                closed.awaitUninterruptibly(1, TimeUnit.SECONDS);
            }
        }

        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);

        notifyDown(null);
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            // Transport not up; datagram semantics allow the loss.
            log.debug("Dropping {} byte datagram to {}: transport down", payload.length, remote);
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        DatagramPacket pkt = new DatagramPacket(buf, (InetSocketAddress) remote);
        ch.writeAndFlush(pkt).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.debug("Datagram to {} failed", remote, future.cause());
            }
        });
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return ch != null ? ch.localAddress() : null;
    }

    private void notifyDown(Throwable cause)
    {
        DatagramEndpointListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            SocketAddress remote = packet.sender();
            try {
                l.onDatagram(remote, bytes);
            }
            catch (RuntimeException e) {
                // A listener fault is not a channel fault; keep the socket open.
                log.error("Listener failed on datagram from {}", remote, e);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // ICMP port-unreachable surfaces here on some platforms; the socket
            // stays usable afterwards.
            if (cause instanceof PortUnreachableException) {
                log.debug("UDP peer unreachable", cause);
                return;
            }
            log.warn("UDP channel failed", cause);
            notifyDown(cause);
            ctx.close();
        }
    }
}
