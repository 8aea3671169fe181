package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.HostAndPort;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.SocketConfig;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.SocketManager;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.NoRouteToHostException;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;

import static io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpCommand.CONNECT;
import static io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpCommand.STARTTLS;

/**
 * Client side of one SMTP connection: greeting, EHLO/HELO, optional STARTTLS and the envelope commands.
 * Not thread-safe; a client is used by one sender at a time.
 */
@Slf4j
public class SmtpClient {

    private final SocketManager socketManager;
    private final SmtpTlsConfig smtpTlsConfig;
    private final SmtpCommandHandler smtpCommandHandler;
    private final int greetingTimeout;
    private final int dataReadTimeout;

    @Getter
    private final SmtpSession sessionInfo;

    @Getter
    private String helo;

    public SmtpClient(SocketConfig socketConfig, SmtpTlsConfig smtpTlsConfig, int greetingTimeout, int dataReadTimeout,
                      boolean traceLog) {
        this.sessionInfo = new SmtpSession();
        this.socketManager = new SocketManager(socketConfig);
        this.smtpTlsConfig = smtpTlsConfig == null ? SmtpTlsConfig.disabled() : smtpTlsConfig;
        this.greetingTimeout = greetingTimeout;
        this.dataReadTimeout = dataReadTimeout;
        this.smtpCommandHandler = new SmtpCommandHandler(sessionInfo);
        this.smtpCommandHandler.setTraceLog(traceLog);
    }

    /**
     * Connects, reads the greeting and introduces the client, upgrading to TLS when required and offered.
     *
     * @throws SmtpSessionOpenException if any step fails; the socket is closed before throwing
     */
    public SmtpSession open(HostAndPort target, String helo) {
        this.helo = helo;

        SmtpCommandResponse connectResponse = connect(target);
        if (!connectResponse.isSuccess()) {
            throw openFailed(target);
        }

        SmtpCommandResponse heloResponse = smtpCommandHandler.sendEhloOrHelo(helo);
        if (!heloResponse.isSuccess()) {
            throw openFailed(target);
        }

        if (smtpTlsConfig.tlsRequired() && heloResponse.contains(STARTTLS.getCommand())) {
            SmtpCommandResponse tlsResponse = smtpCommandHandler.sendStartTls();

            if (tlsResponse.isSuccess()) {
                processStartTls();
            }
        }

        if (!smtpCommandHandler.isValidSession()) {
            throw openFailed(target);
        }
        return sessionInfo;
    }

    private SmtpCommandResponse connect(HostAndPort target) {
        String message = createSocket(target);
        SmtpCommandResponse connectResponse = new SmtpCommandResponse(CONNECT, List.of(message));
        smtpCommandHandler.addSmtpCommandResponse(connectResponse);

        if (!connectResponse.isSuccess()) {
            return connectResponse;
        }
        return readGreeting();
    }

    private String createSocket(HostAndPort target) {
        try {
            Socket socket = socketManager.createSocket(target);
            sessionInfo.changeSocket(socket);
            return "250 Connection OK";
        } catch (NoRouteToHostException e) {
            return SmtpStatus.NO_ROUTE + " connect to " + target + " " + e;
        } catch (IOException | RuntimeException e) {
            return SmtpStatus.CONNECT_FAILED + " connect to " + target + " " + e;
        }
    }

    private SmtpCommandResponse readGreeting() {
        try {
            sessionInfo.setSoTimeout(greetingTimeout);
            SmtpCommandResponse greeting = smtpCommandHandler.readInitResponse();
            sessionInfo.setSoTimeout(socketManager.getReadTimeout());
            return greeting;
        } catch (SocketException e) {
            smtpCommandHandler.addResponse(CONNECT, SmtpStatus.IO_ERROR + " greeting " + e);
            return new SmtpCommandResponse(CONNECT, List.of(smtpCommandHandler.getCurrentMessage()));
        }
    }

    /**
     * Upgrades to TLS and repeats EHLO. A failed handshake falls back to a fresh plain connection.
     */
    private void processStartTls() {
        try {
            SSLSocket sslSocket = socketManager.upgradeToSslSocket(smtpTlsConfig.enabledTlsProtocols(),
                    smtpTlsConfig.maxAttempts(), smtpTlsConfig.retryDelayMillis());
            sessionInfo.setSslSocket(sslSocket);
            smtpCommandHandler.sendEhlo(helo);
        } catch (IOException e) {
            log.warn("SSL handshake failed, continuing with plain socket. target={}, cause={}",
                    socketManager.getTarget(), e.toString());
            reconnectUsingPlainSocket();
        }
    }

    private void reconnectUsingPlainSocket() {
        try {
            Socket newSocket = socketManager.recreateSocket();
            sessionInfo.changeSocket(newSocket);
            SmtpCommandResponse initResponse = readGreeting();

            if (initResponse.isSuccess()) {
                smtpCommandHandler.sendEhloOrHelo(helo);
            }
        } catch (IOException e) {
            log.error("Failed to reconnect using a plain socket. target={}", socketManager.getTarget(), e);
            smtpCommandHandler.addResponse(CONNECT, SmtpStatus.CONNECT_FAILED + " connect to " + socketManager.getTarget() + " " + e);
        }
    }

    private SmtpSessionOpenException openFailed(HostAndPort target) {
        String message = smtpCommandHandler.getCurrentMessage();
        close();
        return new SmtpSessionOpenException(SmtpStatus.parseStatusCode(message), message, target.toString());
    }

    public SmtpCommandHandler getCommandHandler() {
        return smtpCommandHandler;
    }

    public boolean isSessionValid() {
        return sessionInfo.isConnected() && smtpCommandHandler.isValidSession();
    }

    public SmtpCommandResponse sendMailFrom(String mailFrom) {
        return smtpCommandHandler.sendMailFrom(mailFrom);
    }

    public SmtpCommandResponse sendRcptTo(String rcptTo) {
        return smtpCommandHandler.sendRcptTo(rcptTo);
    }

    public SmtpCommandResponse sendData() {
        return smtpCommandHandler.sendData();
    }

    /**
     * Sends the message body with the longer DATA read timeout, then restores the regular one.
     */
    public SmtpCommandResponse sendMessage(String message) {
        try {
            sessionInfo.setSoTimeout(dataReadTimeout);
            SmtpCommandResponse response = smtpCommandHandler.sendMessage(message);
            sessionInfo.setSoTimeout(socketManager.getReadTimeout());
            return response;
        } catch (SocketException e) {
            smtpCommandHandler.addResponse(SmtpCommand.DATA_END, SmtpStatus.IO_ERROR + " SMTP DATA " + e);
            return new SmtpCommandResponse(SmtpCommand.DATA_END, List.of(smtpCommandHandler.getCurrentMessage()));
        }
    }

    public SmtpCommandResponse sendRset() {
        return smtpCommandHandler.sendRset();
    }

    public SmtpCommandResponse sendNoop() {
        return smtpCommandHandler.sendNoop();
    }

    public SmtpCommandResponse sendQuit() {
        return smtpCommandHandler.sendQuit();
    }

    public void close() {
        sessionInfo.close();
        socketManager.close();
    }
}
