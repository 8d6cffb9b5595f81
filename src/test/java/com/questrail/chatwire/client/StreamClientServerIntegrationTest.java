package com.questrail.chatwire.client;

import com.questrail.chatwire.api.CloseReason;
import com.questrail.chatwire.api.RecordingServerCallbacks;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.config.ClientConfig;
import com.questrail.chatwire.config.ServerConfig;
import com.questrail.chatwire.protocol.model.MessageKind;
import com.questrail.chatwire.runtime.ChatClientRuntime;
import com.questrail.chatwire.runtime.ChatServerRuntime;
import com.questrail.chatwire.server.ChatServer;
import com.questrail.chatwire.session.AbstractSession;
import com.questrail.chatwire.transport.PeerUnreachableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.chatwire.api.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StreamClientServerIntegrationTest
 * -----------------------------------------------------------------------------
 * Real TCP server and clients on the loopback interface, ephemeral port.
 */
class StreamClientServerIntegrationTest
{
    private RecordingServerCallbacks recorded;
    private ChatServerRuntime runtime;
    private ChatServer server;
    private final List<ChatClient> clients = new ArrayList<>();

    @BeforeEach
    void startServer() throws IOException
    {
        recorded = new RecordingServerCallbacks();
        runtime = ChatServerRuntime.builder()
                .withConfig(ServerConfig.builder(TransportProtocol.STREAM)
                        .withBindAddress(new InetSocketAddress("127.0.0.1", 0))
                        .withAcceptPollInterval(Duration.ofMillis(100))
                        .withReadTimeout(Duration.ofMillis(100))
                        .withShutdownTimeout(Duration.ofSeconds(2))
                        .build())
                .withCallbacks(recorded.callbacks())
                .build();
        runtime.start();
        server = runtime.server();
    }

    @AfterEach
    void stopAll()
    {
        for (ChatClient c : clients) {
            c.close();
        }
        runtime.stop();
    }

    private ChatClient client(RecordingClientListener listener)
    {
        ChatClient c = ChatClientRuntime.builder()
                .withConfig(ClientConfig.builder(TransportProtocol.STREAM,
                                (InetSocketAddress) server.localAddress())
                        .withReadTimeout(Duration.ofMillis(100))
                        .build())
                .withListener(listener)
                .build();
        clients.add(c);
        return c;
    }

    // ---------------------------------------------------------------------

    @Test
    void connectIsWelcomedAndAnnounced() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        ChatClient c = client(alice);

        c.connect("alice");

        assertTrue(c.isConnected());
        assertEquals("alice", c.displayName());
        await("welcome notice", () -> !alice.messages(MessageKind.STATUS).isEmpty());
        assertTrue(alice.messages(MessageKind.STATUS).get(0).content().startsWith("Welcome! Your username: "));
        assertEquals(AbstractSession.SYSTEM_SENDER, alice.messages(MessageKind.STATUS).get(0).sender());

        await("server sees alice", () -> recorded.connected().size() == 1);
        assertEquals("alice", recorded.connected().get(0).displayName());
        assertEquals(1, server.peerCount());
    }

    @Test
    void chatFlowsBothWays() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        ChatClient c = client(alice);
        c.connect("alice");
        await("server sees alice", () -> recorded.connected().size() == 1);

        assertTrue(c.send("hello"));
        await("server receives hello", () -> recorded.messageTexts().contains("hello"));
        assertEquals("alice", recorded.messages().get(0).peer().displayName());

        String id = server.peers().get(0).identifier();
        assertTrue(server.send(id, "hi alice"));
        await("alice receives reply", () -> alice.heard(MessageKind.CHAT, "hi alice"));
        assertEquals("server", alice.messages(MessageKind.CHAT).get(0).sender());
    }

    @Test
    void latencyProbeIsAnswered() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        ChatClient c = client(alice);
        c.connect("alice");

        assertTrue(c.sendTest());

        await("latency measured", () -> !alice.latencies().isEmpty());
        assertTrue(alice.latencies().get(0).compareTo(Duration.ofSeconds(5)) < 0);
        assertTrue(alice.messages(MessageKind.TEST).isEmpty(), "echo is not surfaced as a message");
    }

    @Test
    void statusFromClientReachesServerListener() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        ChatClient c = client(alice);
        c.connect("alice");

        assertTrue(c.sendStatus("away"));

        await("status delivered", () -> recorded.hasStatus("alice: away", false));
    }

    @Test
    void secondPeerJoiningIsAnnounced() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        RecordingClientListener bob = new RecordingClientListener();
        client(alice).connect("alice");
        await("alice active", () -> recorded.connected().size() == 1);

        ChatClient b = client(bob);
        b.connect("bob");

        await("alice hears bob", () -> alice.heard(MessageKind.STATUS, "bob joined the chat"));

        b.disconnect();
        await("alice hears bob leave", () -> alice.heard(MessageKind.STATUS, "bob left the chat"));
        await("bob removed", () -> server.peerCount() == 1);
        assertEquals(CloseReason.PEER_DISCONNECTED, recorded.disconnected().get(0).reason());
    }

    @Test
    void broadcastReachesAllClients() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        RecordingClientListener bob = new RecordingClientListener();
        client(alice).connect("alice");
        client(bob).connect("bob");
        await("both active", () -> recorded.connected().size() == 2);

        assertEquals(2, server.broadcast("maintenance at noon"));

        await("alice got broadcast", () -> alice.heard(MessageKind.CHAT, "maintenance at noon"));
        await("bob got broadcast", () -> bob.heard(MessageKind.CHAT, "maintenance at noon"));
    }

    // ---------------------------------------------------------------------
    // Text too large for one frame
    // ---------------------------------------------------------------------

    private static final String TOO_LARGE = "x".repeat(1_100_000);

    @Test
    void oversizedClientSendIsRefusedAndConnectionSurvives() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        ChatClient c = client(alice);
        c.connect("alice");
        await("server sees alice", () -> recorded.connected().size() == 1);

        assertFalse(c.send(TOO_LARGE));

        assertTrue(c.isConnected());
        assertTrue(alice.disconnects().isEmpty(), alice.disconnects().toString());
        assertTrue(c.send("still here"));
        await("follow-up delivered", () -> recorded.messageTexts().contains("still here"));
        assertEquals(1, server.peerCount());
    }

    @Test
    void oversizedServerSendKeepsPeersConnected() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        RecordingClientListener bob = new RecordingClientListener();
        client(alice).connect("alice");
        client(bob).connect("bob");
        await("both active", () -> recorded.connected().size() == 2);

        String id = server.peers().get(0).identifier();
        assertFalse(server.send(id, TOO_LARGE));
        assertEquals(0, server.broadcast(TOO_LARGE));

        assertEquals(2, server.peerCount());
        assertTrue(recorded.disconnected().isEmpty());
        assertEquals(2, server.broadcast("after the big one"));
        await("alice got follow-up", () -> alice.heard(MessageKind.CHAT, "after the big one"));
        await("bob got follow-up", () -> bob.heard(MessageKind.CHAT, "after the big one"));
        assertTrue(alice.disconnects().isEmpty());
        assertTrue(bob.disconnects().isEmpty());
    }

    @Test
    void serverStopDisconnectsClient() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        ChatClient c = client(alice);
        c.connect("alice");
        await("alice active", () -> recorded.connected().size() == 1);

        runtime.stop();

        await("client notified", () -> !alice.disconnects().isEmpty());
        assertFalse(c.isConnected());
        CloseReason reason = alice.disconnects().get(0);
        assertTrue(reason == CloseReason.PEER_DISCONNECTED || reason == CloseReason.PEER_CLOSED, reason.name());
        assertTrue(recorded.hasStatus("Server stopped", false));
        assertFalse(server.isRunning());
    }

    @Test
    void clientCanReconnectAfterDisconnect() throws PeerUnreachableException
    {
        RecordingClientListener alice = new RecordingClientListener();
        ChatClient c = client(alice);
        c.connect("alice");
        c.disconnect();
        assertFalse(c.isConnected());
        assertFalse(c.send("dropped"));

        c.connect("alice2");

        await("second session active", () -> recorded.connected().stream()
                .anyMatch(p -> p.displayName().equals("alice2")));
        assertTrue(c.send("back"));
        await("server receives back", () -> recorded.messageTexts().contains("back"));
    }

    @Test
    void connectRejectsBlankNameAndDoubleConnect() throws PeerUnreachableException
    {
        ChatClient c = client(new RecordingClientListener());

        assertThrows(IllegalArgumentException.class, () -> c.connect("  "));

        c.connect("alice");
        assertThrows(IllegalStateException.class, () -> c.connect("again"));
    }

    @Test
    void unreachableServerIsReported() throws IOException
    {
        int closedPort;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = probe.getLocalPort();
        }
        ChatClient c = ChatClientRuntime.builder()
                .withConfig(ClientConfig.builder(TransportProtocol.STREAM,
                                new InetSocketAddress("127.0.0.1", closedPort))
                        .withConnectTimeout(Duration.ofSeconds(1))
                        .build())
                .withListener(new RecordingClientListener())
                .build();

        PeerUnreachableException e = assertThrows(PeerUnreachableException.class, () -> c.connect("alice"));

        assertEquals(new InetSocketAddress("127.0.0.1", closedPort), e.address());
        assertFalse(c.isConnected());
    }
}
