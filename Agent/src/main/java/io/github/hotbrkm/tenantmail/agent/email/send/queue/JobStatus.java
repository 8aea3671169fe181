package io.github.hotbrkm.tenantmail.agent.email.send.queue;

public enum JobStatus {
    WAITING, DELAYED, ACTIVE, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
