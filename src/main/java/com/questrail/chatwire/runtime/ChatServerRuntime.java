package com.questrail.chatwire.runtime;

import com.questrail.chatwire.api.MessageDeliveryListener;
import com.questrail.chatwire.api.PeerLifecycleListener;
import com.questrail.chatwire.api.ServerCallbacks;
import com.questrail.chatwire.api.StatusListener;
import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.config.ServerConfig;
import com.questrail.chatwire.internal.time.DedicatedThreadScheduler;
import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.SystemMonotonicClock;
import com.questrail.chatwire.internal.time.SystemWallClock;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.observability.Slf4jChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.protocol.codec.impl.JsonWireCodec;
import com.questrail.chatwire.server.ChatServer;
import com.questrail.chatwire.server.DatagramChatServer;
import com.questrail.chatwire.server.StreamChatServer;
import com.questrail.chatwire.transport.DatagramEndpoint;
import com.questrail.chatwire.transport.SocketDecorator;
import com.questrail.chatwire.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.io.IOException;
import java.util.Objects;

/**
 * ChatServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production chat server.
 *
 * <pre>
 *   ChatServerRuntime runtime = ChatServerRuntime.builder()
 *       .withConfig(ServerConfig.fromEnvironment(TransportProtocol.DATAGRAM, System.getenv()))
 *       .withMessageListener((peer, text) -> ...)
 *       .build();
 *   runtime.start();
 * </pre>
 */
public final class ChatServerRuntime {
    private final ChatServer server;

    private ChatServerRuntime(ChatServer server) {
        this.server = server;
    }

    public void start() throws IOException {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    public ChatServer server() {
        return server;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServerConfig config;
        private ServerCallbacks callbacks = ServerCallbacks.none();
        private ChatObservabilitySink observabilitySink = new Slf4jChatObservabilitySink();
        private SocketDecorator socketDecorator = SocketDecorator.NONE;

        public Builder withConfig(ServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCallbacks(ServerCallbacks callbacks) {
            this.callbacks = callbacks;
            return this;
        }

        public Builder withMessageListener(MessageDeliveryListener listener) {
            this.callbacks = callbacks.withMessages(listener);
            return this;
        }

        public Builder withStatusListener(StatusListener listener) {
            this.callbacks = callbacks.withStatus(listener);
            return this;
        }

        public Builder withLifecycleListener(PeerLifecycleListener listener) {
            this.callbacks = callbacks.withLifecycle(listener);
            return this;
        }

        public Builder withObservabilitySink(ChatObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Applied to every accepted stream socket; ignored for datagrams.
         */
        public Builder withSocketDecorator(SocketDecorator decorator) {
            this.socketDecorator = decorator;
            return this;
        }

        public ChatServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(callbacks, "callbacks");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(socketDecorator, "socketDecorator");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WireCodec codec = new JsonWireCodec();

            ChatServer server;
            if (config.protocol() == TransportProtocol.STREAM) {
                server = new StreamChatServer(
                    config,
                    callbacks,
                    codec,
                    socketDecorator,
                    clock,
                    SystemWallClock.INSTANCE,
                    observabilitySink
                );
            }
            else {
                DatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(
                    config.bindAddress(),
                    config.maxDatagramBytes(),
                    "chatwire-udp-server"
                );
                server = new DatagramChatServer(
                    config,
                    callbacks,
                    codec,
                    endpoint,
                    clock,
                    SystemWallClock.INSTANCE,
                    DedicatedThreadScheduler.factory(clock),
                    observabilitySink
                );
            }

            return new ChatServerRuntime(server);
        }
    }
}
