package io.github.hotbrkm.tenantmail.agent.email.mime;

import java.util.List;

/**
 * Serialized message with its {@code DKIM-Signature} header already prepended, plus the envelope data
 * needed to deliver it.
 */
public record SignedMessage(String messageId, String envelopeFrom, List<String> recipients, String content,
                            String signingDomain, String selector) {

    public SignedMessage {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }
}
