package io.github.hotbrkm.tenantmail.agent.email.audit;

import java.time.Instant;

/**
 * Terminal outcome of one job, handed to the audit sink exactly once per job.
 *
 * @param outcome   {@code delivered} or {@code failed}
 * @param errorCode error kind code of a failed job, null when delivered
 */
public record AuditEvent(long tenantId,
                         String jobId,
                         String jobClass,
                         String domain,
                         String outcome,
                         long durationMs,
                         int attempts,
                         String errorCode,
                         Instant occurredAt) {
}
