package io.github.hotbrkm.tenantmail.agent.email.audit;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit events to the application log. Used when no external audit collaborator is wired.
 */
@Slf4j
public class LoggingAuditEventSink implements AuditEventSink {

    @Override
    public void record(AuditEvent event) {
        log.info("Audit. tenantId={}, jobId={}, jobClass={}, domain={}, outcome={}, durationMs={}, attempts={}, errorCode={}",
                event.tenantId(), event.jobId(), event.jobClass(), event.domain(), event.outcome(), event.durationMs(),
                event.attempts(), event.errorCode());
    }
}
