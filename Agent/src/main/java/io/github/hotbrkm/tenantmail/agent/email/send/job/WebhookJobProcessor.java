package io.github.hotbrkm.tenantmail.agent.email.send.job;

import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContext;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContextProvider;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

@Slf4j
public class WebhookJobProcessor extends TenantScopedJobProcessor<WebhookJob> {

    private final WebhookDispatcher dispatcher;

    public WebhookJobProcessor(TenantContextProvider contextProvider, WebhookDispatcher dispatcher, MeterRegistry meterRegistry) {
        super(contextProvider, meterRegistry);
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    @Override
    protected void handle(WebhookJob job, TenantContext context) {
        log.debug("Dispatching webhook. tenantId={}, jobId={}, method={}, url={}, eventType={}",
                job.tenantId(), job.jobId(), job.method(), job.url(), job.eventType());
        dispatcher.dispatch(job);
    }
}
