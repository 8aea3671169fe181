package io.github.hotbrkm.tenantmail.agent.email.send.job;

/**
 * Performs the HTTP call of a webhook job. Throwing fails the attempt and lets the queue retry it.
 */
@FunctionalInterface
public interface WebhookDispatcher {

    void dispatch(WebhookJob job);
}
