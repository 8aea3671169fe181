package io.github.hotbrkm.tenantmail.agent.email.send.job;

/**
 * One state change of an email job attempt.
 *
 * @param elapsedMs time since the attempt started
 * @param errorCode set only on a transition to {@link EmailJobState#FAILED}
 */
public record JobTransitionEvent(long tenantId,
                                 String jobId,
                                 String domain,
                                 int attempt,
                                 EmailJobState from,
                                 EmailJobState to,
                                 long elapsedMs,
                                 String errorCode) {
}
