/**
 * Transport ports.
 *
 * <p>Datagram traffic flows through the framework-neutral {@link
 * com.questrail.chatwire.transport.DatagramEndpoint}; framework types (Netty
 * channels, buffers, event loops) never leave the adapter package beneath
 * this one. Stream traffic uses blocking sockets directly, with
 * {@link com.questrail.chatwire.transport.SocketDecorator} as the single
 * extension point.</p>
 */
package com.questrail.chatwire.transport;
