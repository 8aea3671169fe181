package io.github.hotbrkm.tenantmail.agent.email.send.queue;

import java.time.Duration;

/**
 * Caller overrides for one job. Lower {@code priority} values run first; null fields keep the class default.
 */
public record JobOptions(int priority, Duration delay, Integer attempts) {

    public static JobOptions defaults() {
        return new JobOptions(0, Duration.ZERO, null);
    }

    public static JobOptions withPriority(int priority) {
        return new JobOptions(priority, Duration.ZERO, null);
    }

    public JobOptions {
        delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        if (attempts != null && attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive");
        }
    }
}
