package com.questrail.chatwire.config;

import com.questrail.chatwire.api.TransportProtocol;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClientConfigTest
{
    @Test
    void defaultsToLocalhostOnProtocolPort()
    {
        ClientConfig tcp = ClientConfig.fromEnvironment(TransportProtocol.STREAM, Map.of());
        ClientConfig udp = ClientConfig.fromEnvironment(TransportProtocol.DATAGRAM, Map.of());

        assertEquals("localhost", tcp.serverAddress().getHostString());
        assertEquals(5050, tcp.serverAddress().getPort());
        assertEquals(5051, udp.serverAddress().getPort());
    }

    @Test
    void builderDefaults()
    {
        ClientConfig c = ClientConfig.builder(TransportProtocol.DATAGRAM,
                new InetSocketAddress("127.0.0.1", 5051)).build();

        assertEquals(Duration.ofSeconds(10), c.connectTimeout());
        assertEquals(Duration.ofSeconds(2), c.probeTimeout());
        assertEquals(Duration.ofSeconds(1), c.readTimeout());
    }

    @Test
    void rejectsNonPositiveTimeouts()
    {
        InetSocketAddress server = new InetSocketAddress("127.0.0.1", 5050);

        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder(TransportProtocol.STREAM, server)
                .withConnectTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder(TransportProtocol.DATAGRAM, server)
                .withProbeTimeout(Duration.ofMillis(-5)).build());
    }
}
