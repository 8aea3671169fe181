package io.github.hotbrkm.tenantmail.agent.email.send.queue;

public record QueueStats(String queueName, int waiting, int active, int completed, int failed, int delayed, boolean paused) {
}
