package io.github.hotbrkm.tenantmail.agent.email.audit;

@FunctionalInterface
public interface OperatorAlertSink {

    void raise(OperatorAlert alert);
}
