package com.questrail.chatwire.runtime;

import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.client.ChatClient;
import com.questrail.chatwire.client.DatagramChatClient;
import com.questrail.chatwire.client.RecordingClientListener;
import com.questrail.chatwire.client.StreamChatClient;
import com.questrail.chatwire.config.ClientConfig;
import com.questrail.chatwire.config.ServerConfig;
import com.questrail.chatwire.observability.NullObservabilitySink;
import com.questrail.chatwire.server.DatagramChatServer;
import com.questrail.chatwire.server.StreamChatServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the composition roots pick the transport named by the config.
 */
class ChatRuntimeWiringTest
{
    @Test
    void serverRuntimeBuildsTransportFromConfig()
    {
        ChatServerRuntime tcp = ChatServerRuntime.builder()
                .withConfig(ServerConfig.builder(TransportProtocol.STREAM).build())
                .build();
        ChatServerRuntime udp = ChatServerRuntime.builder()
                .withConfig(ServerConfig.builder(TransportProtocol.DATAGRAM).build())
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .build();

        assertTrue(tcp.server() instanceof StreamChatServer);
        assertTrue(udp.server() instanceof DatagramChatServer);
        assertFalse(tcp.server().isRunning());
        assertEquals("Stopped", udp.server().statusLine());
    }

    @Test
    void serverRuntimeRequiresConfig()
    {
        assertThrows(NullPointerException.class, () -> ChatServerRuntime.builder().build());
    }

    @Test
    void clientRuntimeBuildsTransportFromConfig()
    {
        InetSocketAddress server = new InetSocketAddress("127.0.0.1", 5050);

        ChatClient tcp = ChatClientRuntime.builder()
                .withConfig(ClientConfig.builder(TransportProtocol.STREAM, server).build())
                .withListener(new RecordingClientListener())
                .build();
        ChatClient udp = ChatClientRuntime.builder()
                .withConfig(ClientConfig.builder(TransportProtocol.DATAGRAM, server).build())
                .withListener(new RecordingClientListener())
                .build();

        assertTrue(tcp instanceof StreamChatClient);
        assertTrue(udp instanceof DatagramChatClient);
        assertFalse(tcp.isConnected());
        assertEquals(TransportProtocol.DATAGRAM, udp.protocol());
    }

    @Test
    void runtimeStartsAndStopsServer() throws IOException
    {
        ChatServerRuntime runtime = ChatServerRuntime.builder()
                .withConfig(ServerConfig.builder(TransportProtocol.STREAM)
                        .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
                        .build())
                .withStatusListener((text, error) -> { })
                .build();

        runtime.start();
        try {
            assertTrue(runtime.server().isRunning());
            assertNotNull(runtime.server().localAddress());
        }
        finally {
            runtime.stop();
        }
        assertFalse(runtime.server().isRunning());
    }
}
