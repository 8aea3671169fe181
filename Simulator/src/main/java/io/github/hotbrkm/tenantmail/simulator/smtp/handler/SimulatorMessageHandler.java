package io.github.hotbrkm.tenantmail.simulator.smtp.handler;

import io.github.hotbrkm.tenantmail.simulator.smtp.dkim.DkimInspection;
import io.github.hotbrkm.tenantmail.simulator.smtp.dkim.DkimSignatureInspector;
import io.github.hotbrkm.tenantmail.simulator.smtp.properties.SimulatorSmtpProperties;
import io.github.hotbrkm.tenantmail.simulator.smtp.service.SmtpMessageStore;
import io.github.hotbrkm.tenantmail.simulator.smtp.util.EmailUtil;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.RejectException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Handles one SMTP session of the mail sink.
 * <p>
 * Recipients listed in {@code rejected-recipients} are refused at RCPT with 550. Accepted messages get an
 * {@code Authentication-Results} header with the DKIM inspection result and are stored once per recipient.
 */
@Slf4j
public class SimulatorMessageHandler implements MessageHandler {

    static final String RECEIVED_COUNTER = "simulator.smtp.message.received";

    private final MessageContext context;
    private final SimulatorSmtpProperties properties;
    private final SmtpMessageStore messageStore;
    private final DkimSignatureInspector dkimInspector;
    private final MeterRegistry meterRegistry;
    private final SmtpSessionState sessionState;

    public SimulatorMessageHandler(MessageContext context,
                                   SimulatorSmtpProperties properties,
                                   SmtpMessageStore messageStore,
                                   DkimSignatureInspector dkimInspector,
                                   MeterRegistry meterRegistry) {
        this.context = context;
        this.properties = properties;
        this.messageStore = messageStore;
        this.dkimInspector = dkimInspector;
        this.meterRegistry = meterRegistry;
        this.sessionState = new SmtpSessionState();
    }

    @Override
    public void from(String from) {
        sessionState.setFrom(from);
        log.debug("SMTP transaction started. remote={}, from={}", context.getRemoteAddress(), from);
    }

    @Override
    public void recipient(String recipient) throws RejectException {
        if (isRejected(recipient)) {
            sessionState.recordRejectedRecipient();
            log.info("Recipient rejected. from={}, recipient={}", sessionState.getFrom(), recipient);
            throw new RejectException(550, "5.1.1 Mailbox unavailable: " + recipient);
        }
        sessionState.addRecipient(recipient);
    }

    @Override
    public String data(InputStream data) throws RejectException {
        try {
            byte[] payload = data.readAllBytes();
            if (!sessionState.hasAcceptedRecipients()) {
                throw new RejectException(554, "5.5.1 No valid recipients");
            }

            String dkimResult = "skipped";
            byte[] payloadToStore = payload;
            if (properties.isInspectDkim()) {
                DkimInspection inspection = dkimInspector.inspect(payload);
                dkimResult = inspection.result().label();
                payloadToStore = prependHeader(payload, inspection.toAuthenticationResults(authServId()));
                log.debug("DKIM inspected. from={}, result={}, domain={}, reason={}",
                        sessionState.getFrom(), dkimResult, inspection.domain(), inspection.reason());
            }

            messageStore.store(sessionState.getFrom(), sessionState.getAcceptedRecipients(), payloadToStore);
            if (meterRegistry != null) {
                meterRegistry.counter(RECEIVED_COUNTER, "dkim", dkimResult).increment();
            }
            return "OK";
        } catch (IOException e) {
            throw new UncheckedIOException("I/O error occurred while processing SMTP data.", e);
        }
    }

    @Override
    public void done() {
        log.debug("SMTP transaction ended. from={}, accepted={}, rejected={}", sessionState.getFrom(),
                sessionState.getAcceptedRecipientCount(), sessionState.getRejectedRecipientCount());
    }

    private boolean isRejected(String recipient) {
        String address = EmailUtil.normalizeAddress(recipient);
        if (address == null) {
            return false;
        }
        List<String> rejected = properties.getRejectedRecipients();
        if (rejected == null) {
            return false;
        }
        for (String entry : rejected) {
            String pattern = EmailUtil.normalizeAddress(entry);
            if (pattern == null) {
                continue;
            }
            if (pattern.startsWith("@") ? address.endsWith(pattern) : address.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    private String authServId() {
        String hostName = properties.getHostName();
        return hostName == null || hostName.isBlank() ? "simulator" : hostName;
    }

    private static byte[] prependHeader(byte[] payload, String authenticationResults) {
        byte[] headerBytes = ("Authentication-Results: " + authenticationResults + "\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] result = new byte[headerBytes.length + payload.length];
        System.arraycopy(headerBytes, 0, result, 0, headerBytes.length);
        System.arraycopy(payload, 0, result, headerBytes.length, payload.length);
        return result;
    }
}
