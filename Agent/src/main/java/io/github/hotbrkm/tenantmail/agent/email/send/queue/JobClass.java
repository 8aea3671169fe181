package io.github.hotbrkm.tenantmail.agent.email.send.queue;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

@Getter
@RequiredArgsConstructor
public enum JobClass {
    EMAIL_PROCESSING("email-processing", QueuePolicy.of(5, 3, Duration.ofSeconds(5), 50, 25)),
    WEBHOOK_DELIVERY("webhook-delivery", QueuePolicy.of(3, 5, Duration.ofSeconds(2), 25, 15)),
    ANALYTICS_PROCESSING("analytics-processing", QueuePolicy.of(10, 2, Duration.ofSeconds(1), 100, 50));

    private final String queuePrefix;
    private final QueuePolicy defaultPolicy;

    /**
     * Deterministic queue name, e.g. {@code email-processing:tenant:42}.
     */
    public String queueName(long tenantId) {
        return queuePrefix + ":tenant:" + tenantId;
    }
}
