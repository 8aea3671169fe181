package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import io.github.hotbrkm.tenantmail.agent.email.config.EmailConfig;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.SocketConfig;

import java.util.Objects;

/**
 * Creates unconnected {@link SmtpClient}s configured from {@code email.smtp}.
 */
public class SmtpClientFactory {
    private final EmailConfig.Smtp smtpConfig;

    public SmtpClientFactory(EmailConfig.Smtp smtpConfig) {
        this.smtpConfig = Objects.requireNonNull(smtpConfig, "smtpConfig must not be null");
    }

    public SmtpClient create() {
        SocketConfig socketConfig = new SocketConfig(smtpConfig.getBindAddress(), smtpConfig.resolveConnectTimeoutMs(),
                smtpConfig.resolveReadTimeoutMs());
        return new SmtpClient(socketConfig, getSmtpTlsConfig(), smtpConfig.resolveGreetingTimeoutMs(),
                smtpConfig.resolveDataReadTimeoutMs(), smtpConfig.isTrace());
    }

    public String helo() {
        return smtpConfig.resolveHelo();
    }

    public int defaultPort() {
        return smtpConfig.resolvePort();
    }

    private SmtpTlsConfig getSmtpTlsConfig() {
        return new SmtpTlsConfig(smtpConfig.getTlsEnabledProtocols(), smtpConfig.getTlsMaxAttempts(),
                smtpConfig.getTlsRetryDelayMs(), smtpConfig.isTlsRequired());
    }
}
