package io.github.hotbrkm.tenantmail.agent.email.send.queue;

import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.support.NamedThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * Work queue of one (tenant, job class) pair.
 * <p>
 * Jobs run on a worker pool owned by this queue, at most {@code policy.concurrency()} at a time.
 * Waiting jobs are taken by priority value, then by enqueue order. Delays and retry backoff are timed on a
 * scheduler shared by all queues; once due, a job goes back to the waiting set of this queue only.
 * <p>
 * All state is guarded by the queue's own monitor, so queues of different tenants never contend.
 */
@Slf4j
public class TenantQueue<J extends TenantJob> {

    @Getter
    private final String name;
    @Getter
    private final long tenantId;
    @Getter
    private final JobClass jobClass;
    @Getter
    private final QueuePolicy policy;

    private final JobProcessor<J> processor;
    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService scheduler;
    private final double jitterRatio;
    private final DoubleSupplier random;
    private final Clock clock;

    private final Object lock = new Object();
    private final PriorityQueue<Entry<J>> waiting = new PriorityQueue<>(
            Comparator.<Entry<J>>comparingInt(entry -> entry.priority).thenComparingLong(entry -> entry.sequence));
    // Keyed by enqueue sequence; job ids come from callers and may repeat.
    private final Map<Long, Delayed<J>> delayed = new HashMap<>();
    private final Deque<JobRecord> completed = new ArrayDeque<>();
    private final Deque<JobRecord> failed = new ArrayDeque<>();
    private long sequence;
    private int active;
    private boolean paused;
    private boolean closed;

    TenantQueue(long tenantId, JobClass jobClass, QueuePolicy policy, JobProcessor<J> processor,
                ScheduledExecutorService scheduler, double jitterRatio, DoubleSupplier random, Clock clock) {
        this.tenantId = tenantId;
        this.jobClass = Objects.requireNonNull(jobClass, "jobClass must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.jitterRatio = jitterRatio;
        this.name = jobClass.queueName(tenantId);

        this.workers = new ThreadPoolExecutor(policy.concurrency(), policy.concurrency(), 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), new NamedThreadFactory(name));
        this.workers.allowCoreThreadTimeOut(true);
    }

    /**
     * Adds a job. Returns null when the queue has already been closed so the caller can retry on a fresh queue.
     */
    JobHandle add(J job, JobOptions options) {
        if (job.tenantId() != tenantId || job.jobClass() != jobClass) {
            throw new IllegalArgumentException("Job " + job.jobId() + " does not belong to queue " + name);
        }
        JobOptions effective = options != null ? options : JobOptions.defaults();
        int maxAttempts = effective.attempts() != null ? effective.attempts()
                : job.attempts() != null ? job.attempts() : policy.maxAttempts();

        synchronized (lock) {
            if (closed) {
                return null;
            }
            Entry<J> entry = new Entry<>(job, effective.priority(), sequence++, maxAttempts, clock.instant());
            if (effective.delay().isZero()) {
                waiting.add(entry);
            } else {
                scheduleLocked(entry, effective.delay().toMillis());
            }
            log.debug("Job queued. queue={}, jobId={}, priority={}, delayMs={}",
                    name, job.jobId(), effective.priority(), effective.delay().toMillis());
            pumpLocked();
            return new JobHandle(job.jobId(), name, entry.completion);
        }
    }

    public void pause() {
        synchronized (lock) {
            paused = true;
        }
        log.info("Queue paused. queue={}", name);
    }

    public void resume() {
        synchronized (lock) {
            paused = false;
            pumpLocked();
        }
        log.info("Queue resumed. queue={}", name);
    }

    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    public QueueStats stats() {
        synchronized (lock) {
            return new QueueStats(name, waiting.size(), active, completed.size(), failed.size(), delayed.size(), paused);
        }
    }

    /**
     * Drops completed and failed records older than the policy's retention windows.
     *
     * @return number of records removed
     */
    public int prune() {
        Instant now = clock.instant();
        synchronized (lock) {
            int removed = pruneOlderThan(completed, now.minus(policy.completedRetention()));
            removed += pruneOlderThan(failed, now.minus(policy.failedRetention()));
            return removed;
        }
    }

    /**
     * Closes the queue when it has no waiting, delayed or running job. A closed queue accepts no more jobs.
     */
    boolean closeIfIdle() {
        synchronized (lock) {
            if (!waiting.isEmpty() || !delayed.isEmpty() || active > 0) {
                return false;
            }
            closed = true;
        }
        workers.shutdown();
        return true;
    }

    /**
     * Stops accepting jobs, cancels delayed ones and waits for running jobs to finish.
     */
    void shutdown(Duration timeout) {
        synchronized (lock) {
            closed = true;
            for (Delayed<J> pending : delayed.values()) {
                pending.future.cancel(false);
                pending.entry.completion.completeExceptionally(new CancellationException("Queue " + name + " shut down"));
            }
            delayed.clear();
            for (Entry<J> entry : waiting) {
                entry.completion.completeExceptionally(new CancellationException("Queue " + name + " shut down"));
            }
            waiting.clear();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void pumpLocked() {
        while (!paused && !closed && active < policy.concurrency() && !waiting.isEmpty()) {
            Entry<J> entry = waiting.poll();
            active++;
            try {
                workers.execute(() -> run(entry));
            } catch (RejectedExecutionException e) {
                active--;
                waiting.add(entry);
                log.warn("Worker pool rejected job. queue={}, jobId={}", name, entry.job.jobId());
                return;
            }
        }
    }

    private void run(Entry<J> entry) {
        int attemptNumber = ++entry.attemptsMade;
        try {
            processor.process(entry.job, new JobAttempt(attemptNumber, entry.maxAttempts));
            finish(entry, JobStatus.COMPLETED, null, null);
        } catch (RuntimeException e) {
            handleFailure(entry, e);
        } catch (Error e) {
            log.error("Job processor raised an error. queue={}, jobId={}, attempt={}/{}",
                    name, entry.job.jobId(), attemptNumber, entry.maxAttempts, e);
            finish(entry, JobStatus.FAILED, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        } finally {
            synchronized (lock) {
                active--;
                pumpLocked();
            }
        }
    }

    private void handleFailure(Entry<J> entry, RuntimeException e) {
        boolean retryable = !(e instanceof TenantMailException tme) || tme.isRetryable();
        String errorCode = e instanceof TenantMailException mailException ? mailException.getCode() : e.getClass().getSimpleName();

        if (retryable && entry.attemptsMade < entry.maxAttempts) {
            long backoff = policy.computeRetryDelayMillis(entry.attemptsMade);
            long delayMillis = QueuePolicy.applyJitter(backoff, jitterRatio, random.getAsDouble());
            synchronized (lock) {
                if (!closed) {
                    scheduleLocked(entry, delayMillis);
                    log.warn("Job attempt failed, retry scheduled. queue={}, jobId={}, attempt={}/{}, errorCode={}, delayMs={}",
                            name, entry.job.jobId(), entry.attemptsMade, entry.maxAttempts, errorCode, delayMillis);
                    return;
                }
            }
        }
        log.warn("Job failed. queue={}, jobId={}, attempt={}/{}, errorCode={}, message={}",
                name, entry.job.jobId(), entry.attemptsMade, entry.maxAttempts, errorCode, e.getMessage());
        finish(entry, JobStatus.FAILED, errorCode, e.getMessage());
    }

    private void scheduleLocked(Entry<J> entry, long delayMillis) {
        long key = entry.sequence;
        ScheduledFuture<?> future = scheduler.schedule(() -> promote(key), delayMillis, TimeUnit.MILLISECONDS);
        delayed.put(key, new Delayed<>(entry, future));
    }

    private void promote(long key) {
        synchronized (lock) {
            Delayed<J> due = delayed.remove(key);
            if (due == null || closed) {
                return;
            }
            waiting.add(due.entry);
            pumpLocked();
        }
    }

    private void finish(Entry<J> entry, JobStatus status, String errorCode, String failureReason) {
        JobRecord record = new JobRecord(entry.job.jobId(), name, tenantId, jobClass, status, entry.attemptsMade,
                entry.maxAttempts, errorCode, failureReason, entry.enqueuedAt, clock.instant());
        synchronized (lock) {
            if (status == JobStatus.COMPLETED) {
                retain(completed, record, policy.keepCompleted());
            } else {
                retain(failed, record, policy.keepFailed());
            }
        }
        entry.completion.complete(record);
    }

    private static void retain(Deque<JobRecord> records, JobRecord record, int keep) {
        records.addLast(record);
        while (records.size() > keep) {
            records.removeFirst();
        }
    }

    private static int pruneOlderThan(Deque<JobRecord> records, Instant threshold) {
        int removed = 0;
        Iterator<JobRecord> iterator = records.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().finishedAt().isBefore(threshold)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    private static final class Entry<J> {
        private final J job;
        private final int priority;
        private final long sequence;
        private final int maxAttempts;
        private final Instant enqueuedAt;
        private final CompletableFuture<JobRecord> completion = new CompletableFuture<>();
        private volatile int attemptsMade;

        private Entry(J job, int priority, long sequence, int maxAttempts, Instant enqueuedAt) {
            this.job = job;
            this.priority = priority;
            this.sequence = sequence;
            this.maxAttempts = maxAttempts;
            this.enqueuedAt = enqueuedAt;
        }
    }

    private record Delayed<J>(Entry<J> entry, ScheduledFuture<?> future) {
    }
}
