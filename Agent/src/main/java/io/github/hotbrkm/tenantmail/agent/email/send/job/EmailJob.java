package io.github.hotbrkm.tenantmail.agent.email.send.job;

import io.github.hotbrkm.tenantmail.agent.email.domain.EmailAddressUtil;
import io.github.hotbrkm.tenantmail.agent.email.mime.MailContent;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobClass;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.TenantJob;
import io.github.hotbrkm.tenantmail.agent.email.tenant.OperationRequest;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One transactional email to send on behalf of a tenant.
 */
public record EmailJob(String jobId,
                       long tenantId,
                       String from,
                       List<String> to,
                       String subject,
                       String html,
                       String text,
                       int priority,
                       Instant createdAt) implements TenantJob {

    public EmailJob {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(from, "from must not be null");
        to = to == null ? List.of() : List.copyOf(to);
    }

    @Override
    public JobClass jobClass() {
        return JobClass.EMAIL_PROCESSING;
    }

    @Override
    public OperationRequest admissionOperation() {
        return OperationRequest.sendEmail(senderDomain());
    }

    public String senderDomain() {
        return EmailAddressUtil.extractDomain(from);
    }

    public MailContent toMailContent() {
        return new MailContent(from, to, subject, html, text);
    }
}
