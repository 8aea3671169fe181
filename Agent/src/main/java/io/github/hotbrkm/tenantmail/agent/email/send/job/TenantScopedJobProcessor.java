package io.github.hotbrkm.tenantmail.agent.email.send.job;

import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobAttempt;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobProcessor;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.TenantJob;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContext;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContextProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Base for job classes whose work is handed to an external collaborator once the tenant is known to be active.
 */
@Slf4j
abstract class TenantScopedJobProcessor<J extends TenantJob> implements JobProcessor<J> {

    private final TenantContextProvider contextProvider;
    private final MeterRegistry meterRegistry;

    TenantScopedJobProcessor(TenantContextProvider contextProvider, MeterRegistry meterRegistry) {
        this.contextProvider = Objects.requireNonNull(contextProvider, "contextProvider must not be null");
        this.meterRegistry = meterRegistry == null ? new SimpleMeterRegistry() : meterRegistry;
    }

    @Override
    public final void process(J job, JobAttempt attempt) {
        String jobClass = job.jobClass().getQueuePrefix();
        try {
            TenantContext context = contextProvider.getContext(job.tenantId());
            if (!context.active()) {
                throw new TenantMailException(ErrorKind.TENANT_INACTIVE, "Tenant " + job.tenantId() + " is not active");
            }
            handle(job, context);
            log.debug("Job processed. jobClass={}, tenantId={}, jobId={}, attempt={}",
                    jobClass, job.tenantId(), job.jobId(), attempt.attemptNumber());
            meterRegistry.counter("tenantmail.job.outcome", "jobClass", jobClass, "outcome", "completed", "errorKind", "none")
                    .increment();
        } catch (RuntimeException e) {
            String errorCode = e instanceof TenantMailException mailException ? mailException.getCode() : e.getClass().getSimpleName();
            log.warn("Job attempt failed. jobClass={}, tenantId={}, jobId={}, attempt={}/{}, errorCode={}, message={}",
                    jobClass, job.tenantId(), job.jobId(), attempt.attemptNumber(), attempt.maxAttempts(), errorCode,
                    e.getMessage());
            meterRegistry.counter("tenantmail.job.outcome", "jobClass", jobClass, "outcome", "failed", "errorKind", errorCode)
                    .increment();
            throw e;
        }
    }

    protected abstract void handle(J job, TenantContext context);
}
