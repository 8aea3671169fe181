package io.github.hotbrkm.tenantmail.agent.email.send.job;

import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContext;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContextProvider;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

public class AnalyticsJobProcessor extends TenantScopedJobProcessor<AnalyticsJob> {

    private final AnalyticsRecorder recorder;

    public AnalyticsJobProcessor(TenantContextProvider contextProvider, AnalyticsRecorder recorder, MeterRegistry meterRegistry) {
        super(contextProvider, meterRegistry);
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
    }

    @Override
    protected void handle(AnalyticsJob job, TenantContext context) {
        recorder.record(job);
    }
}
