package io.github.hotbrkm.tenantmail.agent.email.send.queue;

/**
 * Processing function bound to one job class. Returning normally completes the job; throwing fails the attempt.
 * A {@link io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException} that is not retryable fails the
 * job without further attempts.
 */
@FunctionalInterface
public interface JobProcessor<J extends TenantJob> {

    void process(J job, JobAttempt attempt);
}
