package io.github.hotbrkm.tenantmail.agent.email.send.queue;

/**
 * One-based attempt number of a job run.
 */
public record JobAttempt(int attemptNumber, int maxAttempts) {

    public boolean isFinal() {
        return attemptNumber >= maxAttempts;
    }
}
