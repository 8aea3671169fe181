package io.github.hotbrkm.tenantmail.agent.email.send.entry;

import io.github.hotbrkm.tenantmail.agent.email.domain.EmailAddressUtil;
import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.send.job.EmailJob;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobHandle;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobOptions;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.TenantQueueManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for request-handling code that wants an email sent.
 * <p>
 * Malformed requests are rejected with {@code JOB_REJECTED}. Tenant, sender domain and send quota are
 * checked by the queue manager before the job is queued, so {@code TENANT_INACTIVE}, {@code DOMAIN_NOT_OWNED}
 * and {@code RATE_LIMIT_EXCEEDED} reach the caller synchronously and nothing is queued.
 */
@Slf4j
public class EmailSubmissionService {

    private final TenantQueueManager queueManager;
    private final Clock clock;

    public EmailSubmissionService(TenantQueueManager queueManager, Clock clock) {
        this.queueManager = Objects.requireNonNull(queueManager, "queueManager must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param html     HTML body, may be null when {@code text} is given
     * @param text     plain-text body, may be null when {@code html} is given
     * @param priority lower values are sent first
     * @return id of the queued job
     */
    public String submitEmailJob(long tenantId, String from, List<String> to, String subject, String html, String text,
                                 int priority) {
        return submit(tenantId, from, to, subject, html, text, priority).jobId();
    }

    /**
     * Same as {@link #submitEmailJob} but returns the handle, whose future completes with the job's terminal record.
     */
    public JobHandle submit(long tenantId, String from, List<String> to, String subject, String html, String text,
                            int priority) {
        requireWellFormed(from, to, html, text);

        EmailJob job = new EmailJob(UUID.randomUUID().toString(), tenantId, from, to, subject, html, text, priority,
                clock.instant());
        JobHandle handle = queueManager.enqueue(job, JobOptions.withPriority(priority));
        log.info("Email job submitted. tenantId={}, jobId={}, queue={}, recipients={}, priority={}",
                tenantId, job.jobId(), handle.queueName(), job.to().size(), priority);
        return handle;
    }

    private static void requireWellFormed(String from, List<String> to, String html, String text) {
        if (from == null || !EmailAddressUtil.isValid(from)) {
            throw new TenantMailException(ErrorKind.JOB_REJECTED, "Invalid sender address: " + from);
        }
        if (to == null || to.isEmpty()) {
            throw new TenantMailException(ErrorKind.JOB_REJECTED, "At least one recipient is required");
        }
        for (String recipient : to) {
            if (recipient == null || !EmailAddressUtil.isValid(recipient)) {
                throw new TenantMailException(ErrorKind.JOB_REJECTED, "Invalid recipient address: " + recipient);
            }
        }
        if (html == null && text == null) {
            throw new TenantMailException(ErrorKind.JOB_REJECTED, "Either an HTML or a text body is required");
        }
    }
}
