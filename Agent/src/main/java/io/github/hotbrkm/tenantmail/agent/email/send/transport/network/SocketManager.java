package io.github.hotbrkm.tenantmail.agent.email.send.transport.network;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.List;
import java.util.Objects;

@Slf4j
public class SocketManager {

    private final SocketConfig config;

    @Getter
    private HostAndPort target;
    private Socket socket;

    public SocketManager(SocketConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public Socket createSocket(HostAndPort target) throws IOException {
        this.target = Objects.requireNonNull(target, "target must not be null");
        Socket created = new Socket();
        try {
            if (config.bindAddress() != null && !config.bindAddress().isBlank()) {
                created.bind(new InetSocketAddress(config.bindAddress(), 0));
            }
            created.connect(new InetSocketAddress(target.host(), target.port()), config.connectionTimeout());
            created.setSoTimeout(config.readTimeout());
        } catch (IOException | RuntimeException e) {
            closeQuietly(created);
            throw e;
        }
        this.socket = created;
        return created;
    }

    public Socket recreateSocket() throws IOException {
        if (target == null) {
            throw new IllegalStateException("No target to reconnect to");
        }
        closeQuietly(socket);
        return createSocket(target);
    }

    public SSLSocket upgradeToSslSocket(List<String> enabledTlsProtocols, int maxAttempts, long retryDelayMillis) throws IOException {
        SslSocketConverter sslSocketConverter = new SslSocketConverter(maxAttempts, retryDelayMillis);
        return sslSocketConverter.upgradeToSslSocket(socket, target.host(), enabledTlsProtocols);
    }

    public int getReadTimeout() {
        return config.readTimeout();
    }

    public void close() {
        closeQuietly(socket);
    }

    private static void closeQuietly(Socket socket) {
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Failed to close socket", e);
            }
        }
    }
}
