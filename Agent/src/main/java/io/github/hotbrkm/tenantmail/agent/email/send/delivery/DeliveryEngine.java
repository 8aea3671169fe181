package io.github.hotbrkm.tenantmail.agent.email.send.delivery;

import io.github.hotbrkm.tenantmail.agent.email.domain.EmailAddressUtil;
import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.mime.SignedMessage;
import io.github.hotbrkm.tenantmail.agent.email.send.result.DeliveryResult;
import io.github.hotbrkm.tenantmail.agent.email.send.result.SendResult;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.HostAndPort;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.routing.RoutingService;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpSessionOpenException;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Delivers signed messages to recipient mail exchangers.
 * <p>
 * Recipients are grouped by domain. For each domain the exchangers are tried in priority order over pooled
 * sessions; a failing exchanger is logged and skipped. Every domain group must be accepted for the delivery
 * to succeed.
 */
@Slf4j
public class DeliveryEngine {

    private final RoutingService routingService;
    private final SmtpConnectionPool connectionPool;
    private final MeterRegistry meterRegistry;

    public DeliveryEngine(RoutingService routingService, SmtpConnectionPool connectionPool, MeterRegistry meterRegistry) {
        this.routingService = Objects.requireNonNull(routingService, "routingService must not be null");
        this.connectionPool = Objects.requireNonNull(connectionPool, "connectionPool must not be null");
        this.meterRegistry = meterRegistry == null ? new SimpleMeterRegistry() : meterRegistry;
    }

    /**
     * @throws TenantMailException {@code NO_MX_RECORDS} when a recipient domain has no exchanger,
     *                             {@code ALL_EXCHANGERS_FAILED} when every exchanger of a domain failed,
     *                             {@code JOB_REJECTED} for a malformed recipient address
     */
    public DeliveryResult deliver(SignedMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        Map<String, List<String>> recipientsByDomain = EmailAddressUtil.groupByDomain(message.recipients());
        if (recipientsByDomain.isEmpty()) {
            throw new TenantMailException(ErrorKind.JOB_REJECTED, "Message has no recipients. messageId=" + message.messageId());
        }
        List<String> invalid = recipientsByDomain.get(EmailAddressUtil.INVALID);
        if (invalid != null) {
            throw new TenantMailException(ErrorKind.JOB_REJECTED, "Invalid recipient address: " + String.join(", ", invalid));
        }

        Map<String, String> exchangersByDomain = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> group : recipientsByDomain.entrySet()) {
            String mxUsed = deliverToDomain(message, group.getKey(), group.getValue());
            exchangersByDomain.put(group.getKey(), mxUsed);
        }

        String firstMx = exchangersByDomain.values().iterator().next();
        return new DeliveryResult(message.messageId(), firstMx, exchangersByDomain);
    }

    private String deliverToDomain(SignedMessage message, String domain, List<String> recipients) {
        List<HostAndPort> targets = routingService.resolveTargets(domain);
        if (targets.isEmpty()) {
            throw new TenantMailException(ErrorKind.NO_MX_RECORDS, "No mail exchanger found for domain " + domain);
        }

        List<String> failures = new ArrayList<>();
        for (HostAndPort target : targets) {
            SendResult result = sendVia(target, message, recipients);
            if (result.success()) {
                log.debug("Message accepted. messageId={}, domain={}, mx={}, recipients={}", message.messageId(), domain,
                        target, recipients.size());
                return target.host();
            }

            log.warn("Exchanger failed, trying next. messageId={}, domain={}, mx={}, code={}, error={}",
                    message.messageId(), domain, target, result.statusCode(), result.errorMessage());
            meterRegistry.counter("tenantmail.delivery.exchanger.failure", "mx", target.host()).increment();
            failures.add(target + " -> " + result.errorMessage());
        }

        throw new TenantMailException(ErrorKind.ALL_EXCHANGERS_FAILED,
                "All " + targets.size() + " exchangers failed for domain " + domain + ": " + String.join("; ", failures));
    }

    private SendResult sendVia(HostAndPort target, SignedMessage message, List<String> recipients) {
        try (PooledSmtpConnection connection = connectionPool.acquire(target)) {
            return connection.send(message.envelopeFrom(), recipients, message.content());
        } catch (SmtpSessionOpenException e) {
            return SendResult.failure(e.getStatusCode(), e.getOriginalMessage());
        } catch (IllegalStateException e) {
            return SendResult.failure(SmtpStatus.SESSION_INVALID, e.getMessage());
        }
    }
}
