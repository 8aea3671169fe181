package io.github.hotbrkm.tenantmail.simulator.smtp.handler;

import io.github.hotbrkm.tenantmail.simulator.smtp.dkim.DkimSignatureInspector;
import io.github.hotbrkm.tenantmail.simulator.smtp.properties.SimulatorSmtpProperties;
import io.github.hotbrkm.tenantmail.simulator.smtp.service.SmtpMessageStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.MessageHandlerFactory;

@RequiredArgsConstructor
public class SimulatorMessageHandlerFactory implements MessageHandlerFactory {

    private final SimulatorSmtpProperties properties;
    private final SmtpMessageStore messageStore;
    private final DkimSignatureInspector dkimInspector;
    private final MeterRegistry meterRegistry;

    @Override
    public MessageHandler create(MessageContext context) {
        return new SimulatorMessageHandler(context, properties, messageStore, dkimInspector, meterRegistry);
    }
}
