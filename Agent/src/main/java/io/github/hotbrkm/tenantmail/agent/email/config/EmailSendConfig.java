package io.github.hotbrkm.tenantmail.agent.email.config;

import io.github.hotbrkm.tenantmail.agent.email.audit.AuditEventSink;
import io.github.hotbrkm.tenantmail.agent.email.audit.LoggingAuditEventSink;
import io.github.hotbrkm.tenantmail.agent.email.audit.LoggingOperatorAlertSink;
import io.github.hotbrkm.tenantmail.agent.email.audit.OperatorAlertSink;
import io.github.hotbrkm.tenantmail.agent.email.mime.DkimSigner;
import io.github.hotbrkm.tenantmail.agent.email.mime.EmailMimeComposer;
import io.github.hotbrkm.tenantmail.agent.email.send.delivery.DeliveryEngine;
import io.github.hotbrkm.tenantmail.agent.email.send.delivery.SmtpConnectionPool;
import io.github.hotbrkm.tenantmail.agent.email.send.entry.EmailSubmissionService;
import io.github.hotbrkm.tenantmail.agent.email.send.job.AnalyticsJobProcessor;
import io.github.hotbrkm.tenantmail.agent.email.send.job.AnalyticsRecorder;
import io.github.hotbrkm.tenantmail.agent.email.send.job.EmailJobProcessor;
import io.github.hotbrkm.tenantmail.agent.email.send.job.LoggingAnalyticsRecorder;
import io.github.hotbrkm.tenantmail.agent.email.send.job.LoggingWebhookDispatcher;
import io.github.hotbrkm.tenantmail.agent.email.send.job.WebhookDispatcher;
import io.github.hotbrkm.tenantmail.agent.email.send.job.WebhookJobProcessor;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.JobClass;
import io.github.hotbrkm.tenantmail.agent.email.send.queue.TenantQueueManager;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.routing.RoutingService;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpClientFactory;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantContextProvider;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.InMemoryTenantStore;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantActivityLog;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Composition root of the delivery core. Collaborators owned by other subsystems (tenant store, audit and
 * alert sinks, webhook dispatcher, analytics recorder) fall back to in-memory or logging implementations
 * when the application does not provide its own bean.
 */
@Configuration
public class EmailSendConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean({TenantDirectory.class, TenantActivityLog.class})
    public InMemoryTenantStore inMemoryTenantStore() {
        return new InMemoryTenantStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditEventSink auditEventSink() {
        return new LoggingAuditEventSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public OperatorAlertSink operatorAlertSink() {
        return new LoggingOperatorAlertSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookDispatcher webhookDispatcher() {
        return new LoggingWebhookDispatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalyticsRecorder analyticsRecorder() {
        return new LoggingAnalyticsRecorder();
    }

    @Bean(destroyMethod = "close")
    public TenantContextProvider tenantContextProvider(EmailConfig emailConfig, TenantDirectory tenantDirectory,
                                                      TenantActivityLog tenantActivityLog, Clock clock,
                                                      MeterRegistry meterRegistry) {
        EmailConfig.Tenant tenant = emailConfig.getTenant();
        return new TenantContextProvider(tenantDirectory, tenantActivityLog, tenant.resolveContextTtl(),
                tenant.resolveLoadTimeout(), tenant.resolveDefaultTimezone(), clock, meterRegistry);
    }

    @Bean
    public EmailMimeComposer emailMimeComposer(Clock clock) {
        return new EmailMimeComposer(new DkimSigner(clock), clock);
    }

    @Bean
    public RoutingService routingService(EmailConfig emailConfig) {
        return new RoutingService(emailConfig);
    }

    @Bean(destroyMethod = "close")
    public SmtpConnectionPool smtpConnectionPool(EmailConfig emailConfig) {
        EmailConfig.Delivery delivery = emailConfig.getDelivery();
        return new SmtpConnectionPool(new SmtpClientFactory(emailConfig.getSmtp()), delivery.resolvePoolMaxConnections(),
                delivery.resolvePoolMaxMessagesPerConnection(), delivery.resolvePoolAcquireTimeout());
    }

    @Bean
    public DeliveryEngine deliveryEngine(RoutingService routingService, SmtpConnectionPool smtpConnectionPool,
                                         MeterRegistry meterRegistry) {
        return new DeliveryEngine(routingService, smtpConnectionPool, meterRegistry);
    }

    @Bean(destroyMethod = "close")
    public EmailJobProcessor emailJobProcessor(EmailConfig emailConfig, TenantContextProvider tenantContextProvider,
                                               EmailMimeComposer emailMimeComposer, DeliveryEngine deliveryEngine,
                                               TenantActivityLog tenantActivityLog, AuditEventSink auditEventSink,
                                               OperatorAlertSink operatorAlertSink, Clock clock, MeterRegistry meterRegistry) {
        return new EmailJobProcessor(tenantContextProvider, emailMimeComposer, deliveryEngine, tenantActivityLog,
                auditEventSink, operatorAlertSink, emailConfig.getQueue().resolveSigningTimeout(), clock, meterRegistry);
    }

    /**
     * Queue manager with one processor per job class.
     * Calls start() on application startup and shutdown() on termination.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public TenantQueueManager tenantQueueManager(EmailConfig emailConfig, TenantContextProvider tenantContextProvider,
                                                 EmailJobProcessor emailJobProcessor, WebhookDispatcher webhookDispatcher,
                                                 AnalyticsRecorder analyticsRecorder, Clock clock, MeterRegistry meterRegistry) {
        EmailConfig.Queue queue = emailConfig.getQueue();
        TenantQueueManager manager = new TenantQueueManager(tenantContextProvider, queue::resolvePolicy,
                queue.resolveJitterRatio(), clock);
        manager.registerProcessor(JobClass.EMAIL_PROCESSING, emailJobProcessor);
        manager.registerProcessor(JobClass.WEBHOOK_DELIVERY,
                new WebhookJobProcessor(tenantContextProvider, webhookDispatcher, meterRegistry));
        manager.registerProcessor(JobClass.ANALYTICS_PROCESSING,
                new AnalyticsJobProcessor(tenantContextProvider, analyticsRecorder, meterRegistry));
        return manager;
    }

    @Bean
    public EmailSubmissionService emailSubmissionService(TenantQueueManager tenantQueueManager, Clock clock) {
        return new EmailSubmissionService(tenantQueueManager, clock);
    }
}
