package io.github.hotbrkm.tenantmail.agent.email.send.queue;

import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.support.NamedThreadFactory;
import io.github.hotbrkm.tenantmail.agent.email.tenant.OperationRequest;
import io.github.hotbrkm.tenantmail.agent.email.tenant.OperationValidation;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContext;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContextProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;
import java.util.function.Function;

/**
 * Owns one {@link TenantQueue} per (tenant, job class) pair.
 * <p>
 * Queues are created lazily under their deterministic name through {@link ConcurrentHashMap#computeIfAbsent},
 * so concurrent first jobs of a tenant always land in the same queue instance, and a queue never holds jobs
 * of another tenant. Each job class is bound to exactly one processor.
 */
@Slf4j
public class TenantQueueManager {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final TenantContextProvider contextProvider;
    private final Function<JobClass, QueuePolicy> policyResolver;
    private final double jitterRatio;
    private final DoubleSupplier random;
    private final Clock clock;

    private final ConcurrentHashMap<String, TenantQueue<? extends TenantJob>> queues = new ConcurrentHashMap<>();
    private final Map<JobClass, JobProcessor<? extends TenantJob>> processors = new EnumMap<>(JobClass.class);
    private final ScheduledThreadPoolExecutor scheduler;
    // Queue creation holds the read lock; shutdown takes the write lock so no queue appears after the snapshot.
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();

    private volatile boolean running;

    public TenantQueueManager(TenantContextProvider contextProvider, Function<JobClass, QueuePolicy> policyResolver,
                              double jitterRatio, Clock clock) {
        this(contextProvider, policyResolver, jitterRatio, () -> ThreadLocalRandom.current().nextDouble(), clock);
    }

    public TenantQueueManager(TenantContextProvider contextProvider, Function<JobClass, QueuePolicy> policyResolver,
                              double jitterRatio, DoubleSupplier random, Clock clock) {
        this.contextProvider = Objects.requireNonNull(contextProvider, "contextProvider must not be null");
        this.policyResolver = Objects.requireNonNull(policyResolver, "policyResolver must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.jitterRatio = jitterRatio;

        this.scheduler = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("tenant-queue-scheduler"));
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    /**
     * Binds the processing function of a job class. A class takes one processor, and one processor instance
     * serves one class.
     */
    public <J extends TenantJob> void registerProcessor(JobClass jobClass, JobProcessor<J> processor) {
        Objects.requireNonNull(jobClass, "jobClass must not be null");
        Objects.requireNonNull(processor, "processor must not be null");
        synchronized (processors) {
            if (processors.containsKey(jobClass)) {
                throw new IllegalStateException("Processor already registered for " + jobClass.getQueuePrefix());
            }
            for (Map.Entry<JobClass, JobProcessor<? extends TenantJob>> entry : processors.entrySet()) {
                if (entry.getValue() == processor) {
                    throw new IllegalStateException("Processor already bound to " + entry.getKey().getQueuePrefix());
                }
            }
            processors.put(jobClass, processor);
        }
        log.info("Processor registered. jobClass={}, processor={}", jobClass.getQueuePrefix(),
                processor.getClass().getSimpleName());
    }

    public void start() {
        running = true;
        log.info("Tenant queue manager started. jobClasses={}", processors.keySet());
    }

    /**
     * Returns the queue of the pair, creating it on first use.
     *
     * @throws IllegalStateException if no processor is registered for the job class or the manager is shut down
     */
    public <J extends TenantJob> TenantQueue<J> getOrCreateQueue(long tenantId, JobClass jobClass) {
        lifecycleLock.readLock().lock();
        try {
            if (!running) {
                throw new IllegalStateException("Tenant queue manager is not running");
            }
            JobProcessor<J> processor = processorFor(jobClass);
            @SuppressWarnings("unchecked")
            TenantQueue<J> queue = (TenantQueue<J>) queues.computeIfAbsent(jobClass.queueName(tenantId), name -> {
                QueuePolicy policy = policyResolver.apply(jobClass);
                log.info("Queue created. queue={}, concurrency={}, attempts={}, backoffBaseMs={}",
                        name, policy.concurrency(), policy.maxAttempts(), policy.backoffBase().toMillis());
                return new TenantQueue<>(tenantId, jobClass, policy, processor, scheduler, jitterRatio, random, clock);
            });
            return queue;
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    public <J extends TenantJob> JobHandle enqueue(J job) {
        return enqueue(job, JobOptions.defaults());
    }

    /**
     * Admits a job into its tenant's queue for the job's class.
     *
     * @throws TenantMailException {@code TENANT_INACTIVE} when the tenant is not active, or the kind of the
     *                             denial returned by the job's admission check
     */
    public <J extends TenantJob> JobHandle enqueue(J job, JobOptions options) {
        Objects.requireNonNull(job, "job must not be null");
        long tenantId = job.tenantId();
        admit(job);

        // A queue reaped between lookup and add reports null; the next lookup creates a fresh one.
        while (true) {
            TenantQueue<J> queue = getOrCreateQueue(tenantId, job.jobClass());
            JobHandle handle = queue.add(job, options);
            if (handle != null) {
                return handle;
            }
            queues.remove(queue.getName(), queue);
        }
    }

    public void pause(long tenantId) {
        forEachQueue(tenantId, TenantQueue::pause);
    }

    public void resume(long tenantId) {
        forEachQueue(tenantId, TenantQueue::resume);
    }

    /**
     * Prunes expired job records of every queue of the tenant and removes queues left idle and empty.
     *
     * @return number of job records removed
     */
    public int cleanup(long tenantId) {
        int removed = 0;
        for (JobClass jobClass : JobClass.values()) {
            String name = jobClass.queueName(tenantId);
            TenantQueue<? extends TenantJob> queue = queues.get(name);
            if (queue == null) {
                continue;
            }
            removed += queue.prune();
            QueueStats stats = queue.stats();
            if (stats.completed() == 0 && stats.failed() == 0 && !stats.paused()) {
                queues.computeIfPresent(name, (key, current) -> current == queue && queue.closeIfIdle() ? null : current);
            }
        }
        log.debug("Tenant queues cleaned. tenantId={}, removedRecords={}", tenantId, removed);
        return removed;
    }

    public Map<JobClass, QueueStats> getStats(long tenantId) {
        Map<JobClass, QueueStats> stats = new EnumMap<>(JobClass.class);
        for (JobClass jobClass : JobClass.values()) {
            TenantQueue<? extends TenantJob> queue = queues.get(jobClass.queueName(tenantId));
            if (queue != null) {
                stats.put(jobClass, queue.stats());
            }
        }
        return stats;
    }

    public int queueCount() {
        return queues.size();
    }

    public void shutdown() {
        List<TenantQueue<? extends TenantJob>> snapshot;
        lifecycleLock.writeLock().lock();
        try {
            running = false;
            snapshot = new ArrayList<>(queues.values());
            queues.clear();
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        for (TenantQueue<? extends TenantJob> queue : snapshot) {
            queue.shutdown(SHUTDOWN_TIMEOUT);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Tenant queue manager stopped. queues={}", snapshot.size());
    }

    private void admit(TenantJob job) {
        long tenantId = job.tenantId();
        OperationRequest admission = job.admissionOperation();
        if (admission == null) {
            TenantContext context = contextProvider.getContext(tenantId);
            if (!context.active()) {
                throw new TenantMailException(ErrorKind.TENANT_INACTIVE, "Tenant " + tenantId + " is not active");
            }
            return;
        }

        OperationValidation validation = contextProvider.validateOperation(tenantId, admission);
        if (!validation.allowed()) {
            log.info("Job rejected at admission. tenantId={}, jobId={}, jobClass={}, reason={}",
                    tenantId, job.jobId(), job.jobClass().getQueuePrefix(), validation.reason());
            throw validation.toException();
        }
    }

    @SuppressWarnings("unchecked")
    private <J extends TenantJob> JobProcessor<J> processorFor(JobClass jobClass) {
        synchronized (processors) {
            JobProcessor<? extends TenantJob> processor = processors.get(jobClass);
            if (processor == null) {
                throw new IllegalStateException("No processor registered for " + jobClass.getQueuePrefix());
            }
            return (JobProcessor<J>) processor;
        }
    }

    private void forEachQueue(long tenantId, Consumer<TenantQueue<? extends TenantJob>> action) {
        for (JobClass jobClass : JobClass.values()) {
            TenantQueue<? extends TenantJob> queue = queues.get(jobClass.queueName(tenantId));
            if (queue != null) {
                action.accept(queue);
            }
        }
    }
}
