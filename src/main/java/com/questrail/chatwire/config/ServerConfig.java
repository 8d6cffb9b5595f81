package com.questrail.chatwire.config;

import com.questrail.chatwire.api.TransportProtocol;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a chat server, either transport.
 *
 * <p>Stream-only fields ({@code acceptPollInterval}) and datagram-only fields
 * ({@code inactivityTimeout}, {@code reaperInterval}, {@code maxDatagramBytes},
 * {@code reliability}) are ignored by the other transport.</p>
 */
public record ServerConfig(
        InetSocketAddress bindAddress,
        TransportProtocol protocol,
        Duration acceptPollInterval,
        Duration readTimeout,
        int maxConsecutiveDecodeFailures,
        Duration inactivityTimeout,
        Duration reaperInterval,
        Duration shutdownTimeout,
        String serverIdentity,
        boolean announcePresence,
        int maxDatagramBytes,
        ReliabilityPolicy reliability
) {
    public static final int DEFAULT_TCP_PORT = 5050;
    public static final int DEFAULT_UDP_PORT = 5051;
    public static final int MAX_UDP_PAYLOAD = 65507;

    public ServerConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(acceptPollInterval, "acceptPollInterval");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(inactivityTimeout, "inactivityTimeout");
        Objects.requireNonNull(reaperInterval, "reaperInterval");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(serverIdentity, "serverIdentity");
        Objects.requireNonNull(reliability, "reliability");

        requirePositive(acceptPollInterval, "acceptPollInterval");
        requirePositive(readTimeout, "readTimeout");
        requirePositive(inactivityTimeout, "inactivityTimeout");
        requirePositive(reaperInterval, "reaperInterval");
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
        if (maxConsecutiveDecodeFailures <= 0) {
            throw new IllegalArgumentException("maxConsecutiveDecodeFailures must be positive");
        }
        if (maxDatagramBytes <= 0 || maxDatagramBytes > MAX_UDP_PAYLOAD) {
            throw new IllegalArgumentException("maxDatagramBytes must be in 1.." + MAX_UDP_PAYLOAD);
        }
    }

    public static Builder builder(TransportProtocol protocol) {
        return new Builder(protocol);
    }

    /**
     * Server config from environment-style variables.
     *
     * <ul>
     *   <li>{@code CHAT_SERVER_HOST} (default {@code 0.0.0.0})</li>
     *   <li>{@code CHAT_SERVER_TCP_PORT} (default 5050) for {@link TransportProtocol#STREAM}</li>
     *   <li>{@code CHAT_SERVER_UDP_PORT} (default 5051) for {@link TransportProtocol#DATAGRAM}</li>
     * </ul>
     *
     * @param env usually {@code System.getenv()}
     */
    public static ServerConfig fromEnvironment(TransportProtocol protocol, Map<String, String> env) {
        String host = env.getOrDefault("CHAT_SERVER_HOST", "0.0.0.0");
        int port = EnvironmentPorts.portFor(protocol, env);
        return builder(protocol)
                .withBindAddress(new InetSocketAddress(host, port))
                .build();
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static final class Builder {
        private final TransportProtocol protocol;
        private InetSocketAddress bindAddress;
        private Duration acceptPollInterval = Duration.ofSeconds(1);
        private Duration readTimeout = Duration.ofSeconds(1);
        private int maxConsecutiveDecodeFailures = 3;
        private Duration inactivityTimeout = Duration.ofSeconds(60);
        private Duration reaperInterval = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private String serverIdentity = "server";
        private boolean announcePresence = true;
        private int maxDatagramBytes = MAX_UDP_PAYLOAD;
        private ReliabilityPolicy reliability = ReliabilityPolicy.defaults();

        private Builder(TransportProtocol protocol) {
            this.protocol = Objects.requireNonNull(protocol, "protocol");
            int port = protocol == TransportProtocol.STREAM ? DEFAULT_TCP_PORT : DEFAULT_UDP_PORT;
            this.bindAddress = new InetSocketAddress("0.0.0.0", port);
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withAcceptPollInterval(Duration interval) {
            this.acceptPollInterval = interval;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder withMaxConsecutiveDecodeFailures(int max) {
            this.maxConsecutiveDecodeFailures = max;
            return this;
        }

        public Builder withInactivityTimeout(Duration timeout) {
            this.inactivityTimeout = timeout;
            return this;
        }

        public Builder withReaperInterval(Duration interval) {
            this.reaperInterval = interval;
            return this;
        }

        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public Builder withServerIdentity(String identity) {
            this.serverIdentity = identity;
            return this;
        }

        public Builder withAnnouncePresence(boolean announce) {
            this.announcePresence = announce;
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

        public ServerConfig build() {
            return new ServerConfig(
                    bindAddress,
                    protocol,
                    acceptPollInterval,
                    readTimeout,
                    maxConsecutiveDecodeFailures,
                    inactivityTimeout,
                    reaperInterval,
                    shutdownTimeout,
                    serverIdentity,
                    announcePresence,
                    maxDatagramBytes,
                    reliability
            );
        }
    }
}
