package io.github.hotbrkm.tenantmail.agent.email.send.transport.routing;

import io.github.hotbrkm.tenantmail.agent.email.config.EmailConfig;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.dns.DnsClient;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.dns.DnsQueryResult;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.dns.MailExchanger;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.HostAndPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Decides where mail for a recipient domain is sent.
 * <ol>
 *     <li>Relay mode: every domain goes to the single configured relay.</li>
 *     <li>Otherwise the domain's MX records, lowest priority value first, on the SMTP port.</li>
 * </ol>
 * There is no fallback to the domain's A record when it publishes no MX.
 */
@Slf4j
public class RoutingService {
    private final EmailConfig.Delivery deliveryConfig;
    private final DnsClient dnsClient;
    private final int smtpPort;

    public RoutingService(EmailConfig emailConfig) {
        this(emailConfig, createDnsClient(emailConfig));
    }

    public RoutingService(EmailConfig emailConfig, DnsClient dnsClient) {
        Objects.requireNonNull(emailConfig, "emailConfig must not be null");
        this.deliveryConfig = Objects.requireNonNull(emailConfig.getDelivery(), "emailConfig.delivery must not be null");
        this.smtpPort = emailConfig.getSmtp().resolvePort();
        this.dnsClient = Objects.requireNonNull(dnsClient, "dnsClient must not be null");
    }

    /**
     * Returns connection targets in the order they must be tried. An empty list means the domain has no usable exchanger.
     */
    public List<HostAndPort> resolveTargets(String domain) {
        if (domain == null || domain.isBlank()) {
            return Collections.emptyList();
        }

        if (deliveryConfig.isRelayEnabled()) {
            return List.of(HostAndPort.parse(deliveryConfig.resolveRelayServer(), smtpPort));
        }

        DnsQueryResult queryResult = dnsClient.queryMxRecords(domain);
        if (!queryResult.isSuccess()) {
            log.warn("No mail exchanger resolved. domain={}, status={}, message={}", domain, queryResult.status(),
                    queryResult.message());
            return Collections.emptyList();
        }

        return queryResult.exchangers().stream()
                .sorted(MailExchanger.BY_PRIORITY)
                .map(it -> HostAndPort.parse(it.host(), smtpPort))
                .toList();
    }

    public boolean isRelayEnabled() {
        return deliveryConfig.isRelayEnabled();
    }

    private static DnsClient createDnsClient(EmailConfig emailConfig) {
        EmailConfig.Delivery delivery = Objects.requireNonNull(emailConfig, "emailConfig must not be null").getDelivery();
        DnsClient dnsClient = new DnsClient(delivery.getDnsServer());
        dnsClient.setRetryCount(Math.max(1, delivery.getDnsRetryCount()));
        dnsClient.setTraceLog(delivery.isDnsTrace());
        return dnsClient;
    }
}
