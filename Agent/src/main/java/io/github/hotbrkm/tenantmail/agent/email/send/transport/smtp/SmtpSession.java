package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;

/**
 * Socket and line streams of one SMTP conversation. After STARTTLS the streams are switched to the TLS socket.
 */
@Getter
@Slf4j
public class SmtpSession implements AutoCloseable {

    private static final String CRLF = "\r\n";

    private Socket socket;
    private SSLSocket sslSocket;
    private BufferedReader reader;
    private PrintWriter writer;

    public void setSoTimeout(int timeout) throws SocketException {
        Socket active = sslSocket != null ? sslSocket : socket;
        if (active != null) {
            active.setSoTimeout(timeout);
        }
    }

    public void writeMessage(String message) {
        if (writer == null) {
            return;
        }

        writer.print(message);
        writer.print(CRLF);
        writer.flush();
    }

    public String readLine() throws IOException {
        if (reader == null) {
            return null;
        }

        return reader.readLine();
    }

    public boolean isConnected() {
        Socket active = sslSocket != null ? sslSocket : socket;
        return active != null && active.isConnected() && !active.isClosed();
    }

    public boolean isTls() {
        return sslSocket != null;
    }

    public void changeSocket(Socket socket) throws IOException {
        close();
        this.sslSocket = null;
        this.socket = socket;
        changeStream(socket);
    }

    public void setSslSocket(SSLSocket sslSocket) throws IOException {
        this.sslSocket = sslSocket;
        changeStream(sslSocket);
    }

    private void changeStream(Socket source) throws IOException {
        this.writer = new PrintWriter(new OutputStreamWriter(source.getOutputStream(), StandardCharsets.UTF_8), false);
        this.reader = new BufferedReader(new InputStreamReader(source.getInputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public void close() {
        closeQuietly(writer);
        closeQuietly(reader);
        closeQuietly(sslSocket);
        closeQuietly(socket);
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.debug("Failed to close SMTP session resource", e);
            }
        }
    }
}
