package com.questrail.chatwire.config;

import com.questrail.chatwire.api.TransportProtocol;

import java.util.Map;

final class EnvironmentPorts {

    private EnvironmentPorts() {}

    static int portFor(TransportProtocol protocol, Map<String, String> env) {
        String variable;
        int fallback;
        if (protocol == TransportProtocol.STREAM) {
            variable = "CHAT_SERVER_TCP_PORT";
            fallback = ServerConfig.DEFAULT_TCP_PORT;
        }
        else {
            variable = "CHAT_SERVER_UDP_PORT";
            fallback = ServerConfig.DEFAULT_UDP_PORT;
        }

        String raw = env.get(variable);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }

        final int port;
        try {
            port = Integer.parseInt(raw.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(variable + " is not a port number: " + raw, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(variable + " out of range: " + port);
        }
        return port;
    }
}
