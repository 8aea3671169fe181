package io.github.hotbrkm.tenantmail.simulator.smtp.handler;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Envelope collected during one SMTP transaction of a session.
 */
public class SmtpSessionState {

    private final List<String> acceptedRecipients = new ArrayList<>();

    @Getter
    @Setter
    private String from;

    @Getter
    private int rejectedRecipientCount;

    public void addRecipient(String recipient) {
        acceptedRecipients.add(recipient);
    }

    public void recordRejectedRecipient() {
        rejectedRecipientCount++;
    }

    public List<String> getAcceptedRecipients() {
        return Collections.unmodifiableList(acceptedRecipients);
    }

    public int getAcceptedRecipientCount() {
        return acceptedRecipients.size();
    }

    public boolean hasAcceptedRecipients() {
        return !acceptedRecipients.isEmpty();
    }
}
