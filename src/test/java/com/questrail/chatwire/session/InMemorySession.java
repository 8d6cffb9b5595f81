package com.questrail.chatwire.session;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.transport.SendFailureException;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Session with no transport: outbound messages are collected in a list and
 * inbound payloads are pushed in by the test.
 */
final class InMemorySession extends AbstractSession
{
    private final List<ChatMessage> transmitted = new ArrayList<>();
    private final List<CloseReason> released = new ArrayList<>();
    private boolean failSends;

    InMemorySession(SocketAddress remote, SessionContext context)
    {
        super(new PeerRecord(remote, TransportProtocol.STREAM,
                context.wallClock().now(), context.clock().nowNanos()), context);
    }

    void receive(ChatMessage message)
    {
        onPayload(context.codec().encode(message));
    }

    void receiveRaw(byte[] payload)
    {
        onPayload(payload);
    }

    void failSends()
    {
        this.failSends = true;
    }

    List<ChatMessage> transmitted()
    {
        return transmitted;
    }

    List<CloseReason> released()
    {
        return released;
    }

    @Override
    protected void transmit(ChatMessage message) throws SendFailureException
    {
        if (failSends) {
            throw new SendFailureException("Broken pipe", new IOException("Broken pipe"));
        }
        transmitted.add(message);
    }

    @Override
    protected void releaseTransport(CloseReason reason)
    {
        released.add(reason);
    }
}
