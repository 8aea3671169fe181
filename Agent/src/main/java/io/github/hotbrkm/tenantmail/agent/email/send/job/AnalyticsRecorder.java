package io.github.hotbrkm.tenantmail.agent.email.send.job;

@FunctionalInterface
public interface AnalyticsRecorder {

    void record(AnalyticsJob job);
}
