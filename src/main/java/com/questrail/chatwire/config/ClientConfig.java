package com.questrail.chatwire.config;

import com.questrail.chatwire.api.TransportProtocol;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a chat client, either transport.
 *
 * <p>{@code connectTimeout} bounds the stream connect; {@code probeTimeout}
 * bounds the wait for the datagram reachability probe's reply.</p>
 */
public record ClientConfig(
        InetSocketAddress serverAddress,
        TransportProtocol protocol,
        Duration connectTimeout,
        Duration probeTimeout,
        Duration readTimeout,
        int maxDatagramBytes,
        ReliabilityPolicy reliability
) {
    public ClientConfig {
        Objects.requireNonNull(serverAddress, "serverAddress");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(probeTimeout, "probeTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(reliability, "reliability");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (probeTimeout.isNegative() || probeTimeout.isZero()) {
            throw new IllegalArgumentException("probeTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        if (maxDatagramBytes <= 0 || maxDatagramBytes > ServerConfig.MAX_UDP_PAYLOAD) {
            throw new IllegalArgumentException("maxDatagramBytes must be in 1.." + ServerConfig.MAX_UDP_PAYLOAD);
        }
    }

    public static Builder builder(TransportProtocol protocol, InetSocketAddress serverAddress) {
        return new Builder(protocol, serverAddress);
    }

    /**
     * Client config from {@code CHAT_SERVER_HOST} (default {@code localhost}) and
     * the protocol's port variable.
     *
     * @param env usually {@code System.getenv()}
     */
    public static ClientConfig fromEnvironment(TransportProtocol protocol, Map<String, String> env) {
        String host = env.getOrDefault("CHAT_SERVER_HOST", "localhost");
        int port = EnvironmentPorts.portFor(protocol, env);
        return builder(protocol, new InetSocketAddress(host, port)).build();
    }

    public static final class Builder {
        private final TransportProtocol protocol;
        private final InetSocketAddress serverAddress;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration probeTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(1);
        private int maxDatagramBytes = ServerConfig.MAX_UDP_PAYLOAD;
        private ReliabilityPolicy reliability = ReliabilityPolicy.defaults();

        private Builder(TransportProtocol protocol, InetSocketAddress serverAddress) {
            this.protocol = Objects.requireNonNull(protocol, "protocol");
            this.serverAddress = Objects.requireNonNull(serverAddress, "serverAddress");
        }

        public Builder withConnectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder withProbeTimeout(Duration timeout) {
            this.probeTimeout = timeout;
            return this;
        }

        public Builder withReadTimeout(Duration timeout) {
            this.readTimeout = timeout;
            return this;
        }

        public Builder withMaxDatagramBytes(int bytes) {
            this.maxDatagramBytes = bytes;
            return this;
        }

        public Builder withReliability(ReliabilityPolicy reliability) {
            this.reliability = reliability;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                    serverAddress,
                    protocol,
                    connectTimeout,
                    probeTimeout,
                    readTimeout,
                    maxDatagramBytes,
                    reliability
            );
        }
    }
}
