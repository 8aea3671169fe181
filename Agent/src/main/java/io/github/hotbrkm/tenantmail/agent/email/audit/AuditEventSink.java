package io.github.hotbrkm.tenantmail.agent.email.audit;

/**
 * Receiver of terminal job outcomes. Callers treat delivery as best effort.
 */
@FunctionalInterface
public interface AuditEventSink {

    void record(AuditEvent event);
}
