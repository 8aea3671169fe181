package io.github.hotbrkm.tenantmail.agent.email.send.queue;

import java.util.concurrent.CompletableFuture;

/**
 * Returned by enqueue. {@code completion} completes with the terminal {@link JobRecord}, whether the job
 * completed or failed; it completes exceptionally only when the queue is shut down first.
 */
public record JobHandle(String jobId, String queueName, CompletableFuture<JobRecord> completion) {
}
