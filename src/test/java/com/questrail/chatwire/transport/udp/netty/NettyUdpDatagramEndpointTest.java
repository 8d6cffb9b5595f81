package com.questrail.chatwire.transport.udp.netty;

import com.questrail.chatwire.transport.DatagramEndpointListener;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class NettyUdpDatagramEndpointTest
{
    private static class Recorder implements DatagramEndpointListener
    {
        final CountDownLatch up = new CountDownLatch(1);
        final CountDownLatch down = new CountDownLatch(1);
        final AtomicInteger downCalls = new AtomicInteger();
        final AtomicReference<Throwable> downCause = new AtomicReference<>();
        final List<byte[]> payloads = new CopyOnWriteArrayList<>();
        final List<SocketAddress> senders = new CopyOnWriteArrayList<>();
        final CountDownLatch received = new CountDownLatch(1);

        @Override
        public void onTransportUp() {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause) {
            downCalls.incrementAndGet();
            downCause.set(cause);
            down.countDown();
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            senders.add(remote);
            payloads.add(payload);
            received.countDown();
        }
    }

    private static NettyUdpDatagramEndpoint loopback(Recorder r)
    {
        NettyUdpDatagramEndpoint ep = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0), 65507);
        ep.setListener(r);
        return ep;
    }

    @Test
    void deliversDatagramBetweenEndpoints() throws InterruptedException
    {
        Recorder a = new Recorder();
        Recorder b = new Recorder();
        NettyUdpDatagramEndpoint left = loopback(a);
        NettyUdpDatagramEndpoint right = loopback(b);
        try {
            left.start();
            right.start();
            assertTrue(a.up.await(2, TimeUnit.SECONDS));
            assertTrue(b.up.await(2, TimeUnit.SECONDS));

            left.send(right.localAddress(), "ping".getBytes(StandardCharsets.UTF_8));

            assertTrue(b.received.await(2, TimeUnit.SECONDS));
            assertEquals("ping", new String(b.payloads.get(0), StandardCharsets.UTF_8));
            assertEquals(((InetSocketAddress) left.localAddress()).getPort(),
                    ((InetSocketAddress) b.senders.get(0)).getPort());
        }
        finally {
            left.stop();
            right.stop();
        }
    }

    @Test
    void listenerFailureLeavesChannelOpen() throws InterruptedException
    {
        Recorder a = new Recorder();
        CountDownLatch second = new CountDownLatch(1);
        AtomicInteger deliveries = new AtomicInteger();
        Recorder b = new Recorder() {
            @Override
            public void onDatagram(SocketAddress remote, byte[] payload) {
                if (deliveries.incrementAndGet() == 1) {
                    throw new IllegalStateException("listener broke");
                }
                second.countDown();
            }
        };
        NettyUdpDatagramEndpoint left = loopback(a);
        NettyUdpDatagramEndpoint right = loopback(b);
        try {
            left.start();
            right.start();
            assertTrue(a.up.await(2, TimeUnit.SECONDS));
            assertTrue(b.up.await(2, TimeUnit.SECONDS));

            left.send(right.localAddress(), "boom".getBytes(StandardCharsets.UTF_8));
            left.send(right.localAddress(), "after".getBytes(StandardCharsets.UTF_8));

            assertTrue(second.await(2, TimeUnit.SECONDS), "channel kept reading");
            assertEquals(0, b.downCalls.get());
            assertNotNull(right.localAddress());
        }
        finally {
            left.stop();
            right.stop();
        }
    }

    /**
     * Datagrams above Netty's default 2048-byte receive buffer arrive whole.
     */
    @Test
    void largeDatagramIsNotTruncated() throws InterruptedException
    {
        Recorder a = new Recorder();
        Recorder b = new Recorder();
        NettyUdpDatagramEndpoint left = loopback(a);
        NettyUdpDatagramEndpoint right = loopback(b);
        try {
            left.start();
            right.start();
            assertTrue(a.up.await(2, TimeUnit.SECONDS));
            assertTrue(b.up.await(2, TimeUnit.SECONDS));

            byte[] big = new byte[8000];
            big[7999] = 42;
            left.send(right.localAddress(), big);

            assertTrue(b.received.await(2, TimeUnit.SECONDS));
            assertEquals(8000, b.payloads.get(0).length);
            assertEquals(42, b.payloads.get(0)[7999]);
        }
        finally {
            left.stop();
            right.stop();
        }
    }

    @Test
    void stopReportsDownExactlyOnce() throws InterruptedException
    {
        Recorder r = new Recorder();
        NettyUdpDatagramEndpoint ep = loopback(r);
        ep.start();
        assertTrue(r.up.await(2, TimeUnit.SECONDS));

        ep.stop();
        ep.stop();

        assertTrue(r.down.await(2, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(1, r.downCalls.get());
        assertNull(r.downCause.get());
        assertNull(ep.localAddress());
    }

    @Test
    void bindConflictReportsDownWithCause() throws InterruptedException
    {
        Recorder first = new Recorder();
        NettyUdpDatagramEndpoint owner = loopback(first);
        owner.start();
        assertTrue(first.up.await(2, TimeUnit.SECONDS));
        try {
            Recorder second = new Recorder();
            NettyUdpDatagramEndpoint clash = new NettyUdpDatagramEndpoint(
                    (InetSocketAddress) owner.localAddress(), 65507);
            clash.setListener(second);

            clash.start();

            assertTrue(second.down.await(2, TimeUnit.SECONDS));
            assertNotNull(second.downCause.get());
            assertEquals(1, second.up.getCount());
            clash.stop();
        }
        finally {
            owner.stop();
        }
    }

    @Test
    void startWithoutListenerIsRejected()
    {
        NettyUdpDatagramEndpoint ep = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0), 1024);
        try {
            assertThrows(IllegalStateException.class, ep::start);
        }
        finally {
            ep.stop();
        }
    }

    @Test
    void sendBeforeStartIsDropped()
    {
        Recorder r = new Recorder();
        NettyUdpDatagramEndpoint ep = loopback(r);
        try {
            assertDoesNotThrow(() -> ep.send(new InetSocketAddress("127.0.0.1", 9), new byte[] { 1 }));
        }
        finally {
            ep.stop();
        }
    }
}
