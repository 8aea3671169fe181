package io.github.hotbrkm.tenantmail.agent.email.send.queue;

import java.time.Duration;
import java.util.Objects;

/**
 * Concurrency, retry and retention settings of one job class.
 *
 * @param keepCompleted      how many completed job records are kept for inspection
 * @param completedRetention age after which completed job records are pruned by cleanup
 */
public record QueuePolicy(int concurrency,
                          int maxAttempts,
                          Duration backoffBase,
                          Duration backoffMax,
                          int keepCompleted,
                          int keepFailed,
                          Duration completedRetention,
                          Duration failedRetention) {

    public static final Duration DEFAULT_BACKOFF_MAX = Duration.ofMinutes(10);
    public static final Duration DEFAULT_COMPLETED_RETENTION = Duration.ofHours(24);
    public static final Duration DEFAULT_FAILED_RETENTION = Duration.ofDays(7);

    public QueuePolicy {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        backoffMax = backoffMax == null ? DEFAULT_BACKOFF_MAX : backoffMax;
        completedRetention = completedRetention == null ? DEFAULT_COMPLETED_RETENTION : completedRetention;
        failedRetention = failedRetention == null ? DEFAULT_FAILED_RETENTION : failedRetention;
    }

    public static QueuePolicy of(int concurrency, int maxAttempts, Duration backoffBase, int keepCompleted, int keepFailed) {
        return new QueuePolicy(concurrency, maxAttempts, backoffBase, DEFAULT_BACKOFF_MAX, keepCompleted, keepFailed,
                DEFAULT_COMPLETED_RETENTION, DEFAULT_FAILED_RETENTION);
    }

    public QueuePolicy withMaxAttempts(int attempts) {
        return new QueuePolicy(concurrency, attempts, backoffBase, backoffMax, keepCompleted, keepFailed,
                completedRetention, failedRetention);
    }

    /**
     * Exponential delay before the given retry: {@code base * 2^(retry-1)}, capped at {@code backoffMax}.
     */
    public long computeRetryDelayMillis(int retryCount) {
        long initial = backoffBase.toMillis();
        if (retryCount <= 1) {
            return Math.min(initial, backoffMax.toMillis());
        }
        double factor = Math.pow(2.0d, retryCount - 1);
        long candidate = (long) (initial * factor);
        if (candidate < 0L) {
            candidate = Long.MAX_VALUE;
        }
        return Math.min(candidate, backoffMax.toMillis());
    }

    /**
     * Applies symmetric jitter: the delay is spread uniformly over {@code [d*(1-ratio), d*(1+ratio)]}.
     *
     * @param random a value in {@code [0, 1)}
     */
    public static long applyJitter(long delayMillis, double jitterRatio, double random) {
        if (jitterRatio <= 0 || delayMillis <= 0) {
            return delayMillis;
        }
        double offset = (random * 2.0d - 1.0d) * jitterRatio * delayMillis;
        return Math.max(0L, Math.round(delayMillis + offset));
    }
}
