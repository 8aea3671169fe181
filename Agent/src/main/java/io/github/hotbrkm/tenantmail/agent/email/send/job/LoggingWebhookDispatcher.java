package io.github.hotbrkm.tenantmail.agent.email.send.job;

import lombok.extern.slf4j.Slf4j;

/**
 * Dispatcher used when no HTTP collaborator is wired. Logs the call instead of performing it.
 */
@Slf4j
public class LoggingWebhookDispatcher implements WebhookDispatcher {

    @Override
    public void dispatch(WebhookJob job) {
        log.info("Webhook not dispatched, no HTTP dispatcher configured. tenantId={}, jobId={}, url={}, eventType={}",
                job.tenantId(), job.jobId(), job.url(), job.eventType());
    }
}
