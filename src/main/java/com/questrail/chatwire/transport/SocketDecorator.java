package com.questrail.chatwire.transport;

import java.io.IOException;
import java.net.Socket;

/**
 * Hook applied to every stream socket right after it is accepted or connected.
 *
 * <p>An encryption wrapper plugs in here by returning a layered socket (for
 * example one produced by {@code SSLSocketFactory.createSocket(Socket, ...)}).
 * The chat transport itself never encrypts.</p>
 */
@FunctionalInterface
public interface SocketDecorator
{
    /** Returns the socket unchanged. */
    SocketDecorator NONE = (socket, clientMode) -> socket;

    /**
     * @param socket     a connected plain socket
     * @param clientMode {@code true} on the client side of the connection
     * @return the socket to read from and write to; may be {@code socket} itself
     * @throws IOException if wrapping fails; the connection is then dropped
     */
    Socket decorate(Socket socket, boolean clientMode) throws IOException;
}
