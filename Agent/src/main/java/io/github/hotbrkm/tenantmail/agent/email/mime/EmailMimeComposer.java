package io.github.hotbrkm.tenantmail.agent.email.mime;

import io.github.hotbrkm.tenantmail.agent.email.domain.EmailAddressUtil;
import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.tenant.DkimConfiguration;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

@Slf4j
public class EmailMimeComposer {

    private final DkimSigner dkimSigner;
    private final Clock clock;

    public EmailMimeComposer(DkimSigner dkimSigner, Clock clock) {
        this.dkimSigner = Objects.requireNonNull(dkimSigner, "dkimSigner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public SignedMessage compose(MailContent content, DkimConfiguration dkim) {
        return compose(content, dkim, clock.getZone());
    }

    /**
     * Builds the MIME message, signs it with the domain's key and prepends the signature header.
     *
     * @param zone zone used for the {@code Date} header
     */
    public SignedMessage compose(MailContent content, DkimConfiguration dkim, ZoneId zone) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(dkim, "dkim must not be null");

        String envelopeFrom = EmailAddressUtil.extractAddress(content.from());
        List<String> recipients = content.to().stream().map(EmailAddressUtil::extractAddress).toList();
        String messageId = MessageIdGenerator.next(dkim.domainName());

        MimeMessageBuilder messageBuilder = new MimeMessageBuilder();
        try {
            messageBuilder.setFrom(content.from());
            messageBuilder.setTo(content.to());
            messageBuilder.setSubject(content.subject());
            messageBuilder.setMessageId(messageId);
            if (content.text() != null) {
                messageBuilder.addAlterContent("text/plain", content.text());
            }
            if (content.html() != null) {
                messageBuilder.addAlterContent("text/html", content.html());
            }
            messageBuilder.makeHeader(ZonedDateTime.now(clock).withZoneSameInstant(zone), content.headers());
            messageBuilder.makeBody();
        } catch (MessagingException e) {
            throw new TenantMailException(ErrorKind.SIGNING_FAILED, "Failed to build MIME message: " + e.getMessage(), e);
        }

        String signatureHeader = dkimSigner.sign(messageBuilder.toString(), dkim.domainName(), dkim.selector(), dkim.privateKey());
        messageBuilder.setExtension(signatureHeader);
        log.debug("Message composed and signed. messageId={}, domain={}, selector={}, recipients={}",
                messageId, dkim.domainName(), dkim.selector(), recipients.size());

        return new SignedMessage(messageId, envelopeFrom, recipients, messageBuilder.toString(), dkim.domainName(),
                dkim.selector());
    }
}
