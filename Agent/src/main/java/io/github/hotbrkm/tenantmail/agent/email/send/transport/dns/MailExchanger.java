package io.github.hotbrkm.tenantmail.agent.email.send.transport.dns;

import java.util.Comparator;

/**
 * One MX target. Lower {@code priority} values are tried first.
 */
public record MailExchanger(String host, int priority) {

    public static final Comparator<MailExchanger> BY_PRIORITY = Comparator.comparingInt(MailExchanger::priority);

    public MailExchanger {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        host = host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    }
}
