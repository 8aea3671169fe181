package io.github.hotbrkm.tenantmail.agent.email.audit;

import java.time.Instant;

/**
 * High-severity signal for failures only an operator can fix, such as missing or broken DKIM material.
 */
public record OperatorAlert(long tenantId, String jobId, String domain, String errorCode, String message,
                            Instant raisedAt) {
}
