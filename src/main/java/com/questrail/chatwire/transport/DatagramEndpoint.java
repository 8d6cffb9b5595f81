package com.questrail.chatwire.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>This endpoint is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>decoding inbound datagrams with the wire codec</li>
 *   <li>classifying datagrams by source address into peer sessions</li>
 *   <li>reliability (sequence envelopes, acknowledgements, retransmission)</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once per transition.
     * A bind failure is reported through
     * {@link DatagramEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>On shutdown (graceful or error-induced), the endpoint MUST notify its
     * listener via {@link DatagramEndpointListener#onTransportDown(Throwable)} at
     * most once per transition.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint.
     *
     * <p>Fire-and-forget: datagram transports give no delivery feedback. A send
     * before the transport is up is silently dropped.</p>
     *
     * @param remote remote destination
     * @param payload datagram payload
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * The bound local address, or {@code null} while the transport is down.
     */
    SocketAddress localAddress();
}
