package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import java.util.List;

/**
 * STARTTLS settings. With {@code tlsRequired} false the client never attempts STARTTLS.
 */
public record SmtpTlsConfig(List<String> enabledTlsProtocols, int maxAttempts, long retryDelayMillis, boolean tlsRequired) {

    public SmtpTlsConfig {
        enabledTlsProtocols = enabledTlsProtocols == null ? List.of() : List.copyOf(enabledTlsProtocols);
    }

    public static SmtpTlsConfig disabled() {
        return new SmtpTlsConfig(List.of(), 1, 0L, false);
    }
}
