package io.github.hotbrkm.tenantmail.agent.email.send.result;

import java.util.Map;

/**
 * Successful delivery of one message. {@code mxUsed} is the exchanger that accepted the first recipient domain;
 * {@code exchangersByDomain} lists the accepting exchanger per recipient domain.
 */
public record DeliveryResult(String messageId, String mxUsed, Map<String, String> exchangersByDomain) {

    public DeliveryResult {
        exchangersByDomain = exchangersByDomain == null ? Map.of() : Map.copyOf(exchangersByDomain);
    }
}
