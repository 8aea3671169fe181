package io.github.hotbrkm.tenantmail.simulator.config;

import io.github.hotbrkm.tenantmail.simulator.smtp.dkim.DkimSignatureInspector;
import io.github.hotbrkm.tenantmail.simulator.smtp.handler.SimulatorMessageHandlerFactory;
import io.github.hotbrkm.tenantmail.simulator.smtp.properties.SimulatorSmtpProperties;
import io.github.hotbrkm.tenantmail.simulator.smtp.service.SmtpMessageStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.subethamail.smtp.server.SMTPServer;

import java.net.InetAddress;
import java.net.UnknownHostException;

@Slf4j
@Configuration
@EnableConfigurationProperties(SimulatorSmtpProperties.class)
public class SmtpServerConfig {

    private static final String PROPERTY_PREFIX = "simulator.smtp";

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public SMTPServer smtpServer(SimulatorSmtpProperties properties, SimulatorMessageHandlerFactory handlerFactory) {
        SMTPServer smtpServer = buildServer(properties, handlerFactory);
        log.info("Mail sink configured. address={}, inbox={}, inspectDkim={}", smtpServer.getDisplayableLocalSocketAddress(),
                properties.getInboxDirectory(), properties.isInspectDkim());
        return smtpServer;
    }

    @Bean
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public SimulatorMessageHandlerFactory simulatorMessageHandlerFactory(SimulatorSmtpProperties properties,
                                                                         SmtpMessageStore messageStore,
                                                                         DkimSignatureInspector dkimSignatureInspector,
                                                                         MeterRegistry meterRegistry) {
        return new SimulatorMessageHandlerFactory(properties, messageStore, dkimSignatureInspector, meterRegistry);
    }

    @Bean
    public DkimSignatureInspector dkimSignatureInspector(SimulatorSmtpProperties properties) {
        return new DkimSignatureInspector(properties.getDkimPublicKeys());
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Builds an unstarted server for the given properties. Also used to embed the sink in tests.
     */
    public static SMTPServer buildServer(SimulatorSmtpProperties properties, SimulatorMessageHandlerFactory handlerFactory) {
        SMTPServer.Builder builder = new SMTPServer.Builder()
                .messageHandlerFactory(handlerFactory)
                .port(properties.getPort());

        if (properties.getMaxConnections() != null) {
            builder.maxConnections(properties.getMaxConnections());
        }

        if (properties.getMaxMessageSize() != null) {
            builder.maxMessageSize(properties.getMaxMessageSize());
        }

        if (StringUtils.hasText(properties.getHostName())) {
            builder.hostName(properties.getHostName());
        }

        if (StringUtils.hasText(properties.getBindAddress())) {
            builder.bindAddress(resolveBindAddress(properties.getBindAddress()));
        }
        return builder.build();
    }

    private static InetAddress resolveBindAddress(String bindAddress) {
        try {
            return InetAddress.getByName(bindAddress);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Invalid SMTP bind address: " + bindAddress, e);
        }
    }
}
