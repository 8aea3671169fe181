package io.github.hotbrkm.tenantmail.agent.email.send.job;

import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobClass;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.TenantJob;

import java.util.Map;
import java.util.Objects;

/**
 * Outbound webhook call for a tenant event. {@code maxRetries} overrides the class attempt count when set.
 */
public record WebhookJob(String jobId,
                         long tenantId,
                         String url,
                         String method,
                         Map<String, Object> payload,
                         Map<String, String> headers,
                         String eventType,
                         String entityId,
                         Integer maxRetries) implements TenantJob {

    public static final int DEFAULT_ATTEMPTS = 5;

    public WebhookJob {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(url, "url must not be null");
        method = method == null || method.isBlank() ? "POST" : method;
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    @Override
    public JobClass jobClass() {
        return JobClass.WEBHOOK_DELIVERY;
    }

    @Override
    public Integer attempts() {
        return maxRetries != null && maxRetries > 0 ? maxRetries : DEFAULT_ATTEMPTS;
    }
}
