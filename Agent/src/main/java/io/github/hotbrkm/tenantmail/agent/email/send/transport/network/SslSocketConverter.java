package io.github.hotbrkm.tenantmail.agent.email.send.transport.network;

import javax.net.ssl.SSLException;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.Socket;
import java.util.List;

/**
 * Wraps a connected plain socket into TLS after a successful STARTTLS reply.
 */
public class SslSocketConverter {

    private final int maxAttempts;
    private final long retryDelayMillis;

    public SslSocketConverter(int maxAttempts, long retryDelayMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMillis = retryDelayMillis;
    }

    /**
     * Handshake failures are not retried. Other I/O failures are retried up to {@code maxAttempts}.
     */
    public SSLSocket upgradeToSslSocket(Socket socket, String serverName, List<String> enabledTlsProtocols) throws IOException {
        int attemptCount = 0;

        while (true) {
            try {
                SSLSocket sslSocket = createSslSocket(socket, serverName, enabledTlsProtocols);
                sslSocket.startHandshake();
                return sslSocket;
            } catch (SSLException e) {
                throw e;
            } catch (IOException e) {
                attemptCount++;
                if (attemptCount >= maxAttempts) {
                    throw new IOException("Failed to convert socket to SSLSocket after " + maxAttempts + " attempts", e);
                }
                sleepBeforeRetry();
            }
        }
    }

    private void sleepBeforeRetry() throws InterruptedIOException {
        try {
            Thread.sleep(retryDelayMillis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry TLS upgrade");
        }
    }

    private SSLSocket createSslSocket(Socket socket, String serverName, List<String> tlsVersions) throws IOException {
        SSLSocketFactory sslSocketFactory = (SSLSocketFactory) SSLSocketFactory.getDefault();
        SSLSocket sslSocket = (SSLSocket) sslSocketFactory.createSocket(socket, serverName, socket.getPort(), true);

        if (tlsVersions != null && !tlsVersions.isEmpty()) {
            sslSocket.setEnabledProtocols(tlsVersions.toArray(new String[0]));
        }

        return sslSocket;
    }
}
