package io.github.hotbrkm.tenantmail.agent.email.send.queue;

import io.github.hotbrkm.tenantmail.agent.email.tenant.OperationRequest;

/**
 * Payload of a queued job. Each job class has its own implementation.
 */
public interface TenantJob {

    String jobId();

    long tenantId();

    JobClass jobClass();

    /**
     * Operation checked with the tenant context provider before the job is admitted, or null when
     * only the tenant's active flag is checked.
     */
    default OperationRequest admissionOperation() {
        return null;
    }

    /**
     * Attempt count carried by the payload itself, or null to use the class policy. Caller options win over it.
     */
    default Integer attempts() {
        return null;
    }
}
