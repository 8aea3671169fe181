package io.github.hotbrkm.tenantmail.agent.email.send.job;

import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobClass;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.TenantJob;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record AnalyticsJob(String jobId,
                           long tenantId,
                           String eventType,
                           String entityId,
                           String entityType,
                           Map<String, Object> eventData,
                           Instant timestamp) implements TenantJob {

    public AnalyticsJob {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(eventType, "eventType must not be null");
        eventData = eventData == null ? Map.of() : Map.copyOf(eventData);
    }

    @Override
    public JobClass jobClass() {
        return JobClass.ANALYTICS_PROCESSING;
    }
}
