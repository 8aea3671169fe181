package io.github.hotbrkm.tenantmail.agent.email.send.queue;

import java.time.Instant;

/**
 * Terminal record of a job. {@code errorCode} and {@code failureReason} are null for completed jobs.
 */
public record JobRecord(String jobId,
                        String queueName,
                        long tenantId,
                        JobClass jobClass,
                        JobStatus status,
                        int attemptsMade,
                        int maxAttempts,
                        String errorCode,
                        String failureReason,
                        Instant enqueuedAt,
                        Instant finishedAt) {
}
