package io.github.hotbrkm.tenantmail.agent.email.send.transport.network;

import java.util.Locale;

/**
 * Connection target parsed from {@code host} or {@code host:port}. A trailing root dot on the host is dropped.
 */
public record HostAndPort(String host, int port) {

    private static final String COLON = ":";

    public HostAndPort {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        host = cleanHost(host.trim());
    }

    public static HostAndPort parse(String target, int defaultPort) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
        String trimmed = target.trim();
        int colon = trimmed.lastIndexOf(COLON);
        if (colon > 0 && trimmed.indexOf(COLON) == colon) {
            return new HostAndPort(trimmed.substring(0, colon), Integer.parseInt(trimmed.substring(colon + 1)));
        }
        return new HostAndPort(trimmed, defaultPort);
    }

    /**
     * Pool key. Host names are case-insensitive.
     */
    public String key() {
        return host.toLowerCase(Locale.ROOT) + COLON + port;
    }

    private static String cleanHost(String host) {
        return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }

    @Override
    public String toString() {
        return host + COLON + port;
    }
}
