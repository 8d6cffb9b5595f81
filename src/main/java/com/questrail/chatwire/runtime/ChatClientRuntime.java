package com.questrail.chatwire.runtime;

import com.questrail.chatwire.api.TransportProtocol;
import com.questrail.chatwire.client.ChatClient;
import com.questrail.chatwire.client.ChatClientListener;
import com.questrail.chatwire.client.DatagramChatClient;
import com.questrail.chatwire.client.StreamChatClient;
import com.questrail.chatwire.config.ClientConfig;
import com.questrail.chatwire.internal.time.DedicatedThreadScheduler;
import com.questrail.chatwire.internal.time.MonotonicClock;
import com.questrail.chatwire.internal.time.SystemMonotonicClock;
import com.questrail.chatwire.internal.time.SystemWallClock;
import com.questrail.chatwire.observability.ChatObservabilitySink;
import com.questrail.chatwire.observability.Slf4jChatObservabilitySink;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.protocol.codec.impl.JsonWireCodec;
import com.questrail.chatwire.transport.SocketDecorator;
import com.questrail.chatwire.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * ChatClientRuntime
 * =============================================================================
 * Composition root for a production chat client. Builds a {@link ChatClient}
 * for the configured transport; the client owns its own lifecycle.
 */
public final class ChatClientRuntime {

    private ChatClientRuntime() {}

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ClientConfig config;
        private ChatClientListener listener;
        private ChatObservabilitySink observabilitySink = new Slf4jChatObservabilitySink();
        private SocketDecorator socketDecorator = SocketDecorator.NONE;

        public Builder withConfig(ClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withListener(ChatClientListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder withObservabilitySink(ChatObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Applied to the stream socket after connect; ignored for datagrams.
         */
        public Builder withSocketDecorator(SocketDecorator decorator) {
            this.socketDecorator = decorator;
            return this;
        }

        public ChatClient build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(listener, "listener");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(socketDecorator, "socketDecorator");

            WireCodec codec = new JsonWireCodec();

            if (config.protocol() == TransportProtocol.STREAM) {
                return new StreamChatClient(
                    config,
                    listener,
                    codec,
                    socketDecorator,
                    SystemWallClock.INSTANCE,
                    observabilitySink
                );
            }

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            int maxDatagramBytes = config.maxDatagramBytes();

            // A fresh ephemeral-port endpoint per connection.
            return new DatagramChatClient(
                config,
                listener,
                codec,
                () -> new NettyUdpDatagramEndpoint(new InetSocketAddress(0), maxDatagramBytes, "chatwire-udp-client"),
                clock,
                SystemWallClock.INSTANCE,
                DedicatedThreadScheduler.factory(clock),
                observabilitySink
            );
        }
    }
}
