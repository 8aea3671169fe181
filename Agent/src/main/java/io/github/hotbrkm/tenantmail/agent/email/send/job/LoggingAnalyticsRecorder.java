package io.github.hotbrkm.tenantmail.agent.email.send.job;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingAnalyticsRecorder implements AnalyticsRecorder {

    @Override
    public void record(AnalyticsJob job) {
        log.info("Analytics event. tenantId={}, eventType={}, entityType={}, entityId={}, timestamp={}",
                job.tenantId(), job.eventType(), job.entityType(), job.entityId(), job.timestamp());
    }
}
