package io.github.hotbrkm.tenantmail.agent.email.send.job;

import io.github.hotbrkm.tenantmail.agent.email.audit.AuditEvent;
import io.github.hotbrkm.tenantmail.agent.email.audit.AuditEventSink;
import io.github.hotbrkm.tenantmail.agent.email.audit.OperatorAlert;
import io.github.hotbrkm.tenantmail.agent.email.audit.OperatorAlertSink;
import io.github.hotbrkm.tenantmail.agent.email.error.DkimConfigMissingException;
import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.mime.EmailMimeComposer;
import io.github.hotbrkm.tenantmail.agent.email.mime.SignedMessage;
import io.github.hotbrkm.tenantmail.agent.email.send.delivery.DeliveryEngine;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobAttempt;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobProcessor;
import io.github.hotbrkm.tenantmail.agent.email.send.result.DeliveryResult;
import io.github.hotbrkm.tenantmail.agent.email.support.CallTimeoutException;
import io.github.hotbrkm.tenantmail.agent.email.support.TimeLimitedExecutor;
import io.github.hotbrkm.tenantmail.agent.email.tenant.DkimConfiguration;
import io.github.hotbrkm.tenantmail.agent.email.tenant.OperationRequest;
import io.github.hotbrkm.tenantmail.agent.email.tenant.OperationValidation;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContext;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContextProvider;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.DeliveryOutcome;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.EmailOutcomeRecord;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantActivityLog;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Runs one attempt of an {@link EmailJob} through its states:
 * <pre>
 * QUEUED -> CONTEXT_VALIDATED -> DOMAIN_AUTHORIZED -> RATE_CHECKED -> DKIM_VALIDATED -> SIGNED -> DELIVERED
 * </pre>
 * Any step can move the attempt to FAILED. The failure is rethrown as a {@link TenantMailException} so the
 * queue can decide between retrying and failing the job. Validation failures are not retryable; delivery
 * failures are.
 * <p>
 * The outcome log, audit event and operator alert are written once per job, on its terminal attempt. They, the
 * usage stamp and the transition listeners are best effort and never change the attempt's result.
 */
@Slf4j
public class EmailJobProcessor implements JobProcessor<EmailJob>, AutoCloseable {

    private static final String JOB_CLASS_TAG = "email-processing";

    private final TenantContextProvider contextProvider;
    private final EmailMimeComposer composer;
    private final DeliveryEngine deliveryEngine;
    private final TenantActivityLog activityLog;
    private final AuditEventSink auditSink;
    private final OperatorAlertSink alertSink;
    private final Duration signingTimeout;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final TimeLimitedExecutor signingExecutor;
    private final List<JobTransitionListener> listeners = new CopyOnWriteArrayList<>();

    public EmailJobProcessor(TenantContextProvider contextProvider, EmailMimeComposer composer, DeliveryEngine deliveryEngine,
                             TenantActivityLog activityLog, AuditEventSink auditSink, OperatorAlertSink alertSink,
                             Duration signingTimeout, Clock clock, MeterRegistry meterRegistry) {
        this.contextProvider = Objects.requireNonNull(contextProvider, "contextProvider must not be null");
        this.composer = Objects.requireNonNull(composer, "composer must not be null");
        this.deliveryEngine = Objects.requireNonNull(deliveryEngine, "deliveryEngine must not be null");
        this.activityLog = Objects.requireNonNull(activityLog, "activityLog must not be null");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink must not be null");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink must not be null");
        this.signingTimeout = Objects.requireNonNull(signingTimeout, "signingTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.meterRegistry = meterRegistry == null ? new SimpleMeterRegistry() : meterRegistry;
        this.signingExecutor = new TimeLimitedExecutor("dkim-signer");
    }

    public void addListener(JobTransitionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void process(EmailJob job, JobAttempt attempt) {
        long startNanos = System.nanoTime();
        StateTracker tracker = new StateTracker(job, attempt.attemptNumber(), startNanos);
        String domain = job.senderDomain();
        SignedMessage signed = null;

        try {
            TenantContext context = contextProvider.getContext(job.tenantId());
            if (!context.active()) {
                throw new TenantMailException(ErrorKind.TENANT_INACTIVE, "Tenant " + job.tenantId() + " is not active");
            }
            tracker.advance(EmailJobState.CONTEXT_VALIDATED);

            if (!context.ownsDomain(domain)) {
                throw new TenantMailException(ErrorKind.DOMAIN_NOT_OWNED,
                        "Domain " + domain + " is not verified for tenant " + job.tenantId());
            }
            tracker.advance(EmailJobState.DOMAIN_AUTHORIZED);

            OperationValidation validation = contextProvider.validateOperation(job.tenantId(), OperationRequest.sendEmail(domain));
            if (!validation.allowed()) {
                throw validation.toException();
            }
            tracker.advance(EmailJobState.RATE_CHECKED);

            DkimConfiguration dkim = resolveDkim(context, domain);
            tracker.advance(EmailJobState.DKIM_VALIDATED);

            signed = sign(job, dkim, context);
            tracker.advance(EmailJobState.SIGNED);

            DeliveryResult delivery = deliveryEngine.deliver(signed);
            tracker.advance(EmailJobState.DELIVERED);

            DeliveryAttemptResult result = DeliveryAttemptResult.delivered(signed.messageId(), delivery.mxUsed(),
                    elapsedMillis(startNanos));
            onDelivered(job, attempt, domain, result, startNanos);
        } catch (TenantMailException e) {
            onFailed(job, attempt, domain, tracker, signed, e, e.getKind(), e.isRetryable(), startNanos);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing email job. tenantId={}, jobId={}", job.tenantId(), job.jobId(), e);
            onFailed(job, attempt, domain, tracker, signed, e, null, true, startNanos);
            throw e;
        }
    }

    @Override
    public void close() {
        signingExecutor.close();
    }

    private DkimConfiguration resolveDkim(TenantContext context, String domain) {
        Optional<DkimConfiguration> configuration = context.findActiveDkimConfiguration(domain);
        if (configuration.isEmpty()) {
            throw new DkimConfigMissingException(domain, context.configuredDomains(), context.verifiedDomainsWithoutDkim());
        }
        DkimConfiguration dkim = configuration.get();
        if (!dkim.isComplete()) {
            throw new TenantMailException(ErrorKind.DKIM_CONFIG_CORRUPTED,
                    "DKIM configuration of domain " + domain + " is incomplete: " + dkim);
        }
        return dkim;
    }

    private SignedMessage sign(EmailJob job, DkimConfiguration dkim, TenantContext context) {
        try {
            return signingExecutor.call("dkim-sign:" + job.jobId(),
                    () -> composer.compose(job.toMailContent(), dkim, context.settings().timezone()), signingTimeout);
        } catch (TenantMailException e) {
            throw e;
        } catch (CallTimeoutException e) {
            throw new TenantMailException(ErrorKind.SIGNING_FAILED, "Signing timed out for job " + job.jobId(), e);
        } catch (RuntimeException e) {
            throw new TenantMailException(ErrorKind.SIGNING_FAILED,
                    "Signing failed for job " + job.jobId() + ": " + e.getMessage(), e);
        }
    }

    private void onDelivered(EmailJob job, JobAttempt attempt, String domain, DeliveryAttemptResult result, long startNanos) {
        log.info("Email job delivered. tenantId={}, jobId={}, messageId={}, mx={}, attempt={}, durationMs={}",
                job.tenantId(), job.jobId(), result.messageId(), result.mxUsed(), attempt.attemptNumber(), result.durationMs());

        recordOutcome(job, result);
        contextProvider.recordActivity(job.tenantId());
        emitAudit(job, attempt, domain, result);
        recordMetrics("delivered", "none", startNanos);
    }

    private void onFailed(EmailJob job, JobAttempt attempt, String domain, StateTracker tracker, SignedMessage signed,
                          RuntimeException error, ErrorKind kind, boolean retryable, long startNanos) {
        String errorCode = kind != null ? kind.getCode() : error.getClass().getSimpleName();
        tracker.fail(errorCode);

        boolean terminal = !retryable || attempt.isFinal();
        DeliveryAttemptResult result = DeliveryAttemptResult.failed(signed != null ? signed.messageId() : null, kind,
                error.getMessage(), elapsedMillis(startNanos));

        if (terminal) {
            log.warn("Email job failed. tenantId={}, jobId={}, domain={}, attempt={}/{}, errorCode={}, message={}",
                    job.tenantId(), job.jobId(), domain, attempt.attemptNumber(), attempt.maxAttempts(), errorCode,
                    error.getMessage());
        } else {
            log.warn("Email job attempt failed. tenantId={}, jobId={}, domain={}, attempt={}/{}, errorCode={}",
                    job.tenantId(), job.jobId(), domain, attempt.attemptNumber(), attempt.maxAttempts(), errorCode);
        }

        if (terminal) {
            recordOutcome(job, result);
            emitAudit(job, attempt, domain, result);
            if (kind != null && kind.isOperatorAlert()) {
                raiseAlert(job, domain, errorCode, error.getMessage());
            }
        }
        recordMetrics("failed", errorCode, startNanos);
    }

    private void recordOutcome(EmailJob job, DeliveryAttemptResult result) {
        try {
            activityLog.recordEmailOutcome(new EmailOutcomeRecord(job.tenantId(), job.jobId(), result.messageId(), job.from(),
                    job.to(), result.success() ? DeliveryOutcome.DELIVERED : DeliveryOutcome.FAILED, result.mxUsed(),
                    result.errorCode(), result.errorMessage(), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to record email outcome. tenantId={}, jobId={}", job.tenantId(), job.jobId(), e);
        }
    }

    private void emitAudit(EmailJob job, JobAttempt attempt, String domain, DeliveryAttemptResult result) {
        AuditEvent event = new AuditEvent(job.tenantId(), job.jobId(), JOB_CLASS_TAG, domain,
                result.success() ? DeliveryOutcome.DELIVERED.label() : DeliveryOutcome.FAILED.label(),
                result.durationMs(), attempt.attemptNumber(), result.errorCode(), clock.instant());
        try {
            auditSink.record(event);
        } catch (RuntimeException e) {
            log.warn("Failed to emit audit event. tenantId={}, jobId={}", job.tenantId(), job.jobId(), e);
        }
    }

    private void raiseAlert(EmailJob job, String domain, String errorCode, String message) {
        try {
            alertSink.raise(new OperatorAlert(job.tenantId(), job.jobId(), domain, errorCode, message, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to raise operator alert. tenantId={}, jobId={}", job.tenantId(), job.jobId(), e);
        }
    }

    private void recordMetrics(String outcome, String errorKind, long startNanos) {
        meterRegistry.counter("tenantmail.job.outcome", "jobClass", JOB_CLASS_TAG, "outcome", outcome, "errorKind", errorKind)
                .increment();
        Timer.builder("tenantmail.job.duration")
                .tag("jobClass", JOB_CLASS_TAG)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private final class StateTracker {
        private final EmailJob job;
        private final int attempt;
        private final long startNanos;
        private EmailJobState state = EmailJobState.QUEUED;

        private StateTracker(EmailJob job, int attempt, long startNanos) {
            this.job = job;
            this.attempt = attempt;
            this.startNanos = startNanos;
        }

        void advance(EmailJobState next) {
            transition(next, null);
        }

        void fail(String errorCode) {
            transition(EmailJobState.FAILED, errorCode);
        }

        private void transition(EmailJobState next, String errorCode) {
            EmailJobState previous = state;
            state = next;
            JobTransitionEvent event = new JobTransitionEvent(job.tenantId(), job.jobId(), job.senderDomain(), attempt,
                    previous, next, elapsedMillis(startNanos), errorCode);
            log.debug("Email job transition. tenantId={}, jobId={}, from={}, to={}, elapsedMs={}",
                    job.tenantId(), job.jobId(), previous.getLabel(), next.getLabel(), event.elapsedMs());
            for (JobTransitionListener listener : listeners) {
                try {
                    listener.onTransition(event);
                } catch (RuntimeException e) {
                    log.warn("Transition listener failed. jobId={}, to={}", job.jobId(), next.getLabel(), e);
                }
            }
        }
    }
}
