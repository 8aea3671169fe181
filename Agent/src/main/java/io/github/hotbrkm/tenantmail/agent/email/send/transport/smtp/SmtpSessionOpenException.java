package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import lombok.Getter;

/**
 * Raised when a session cannot be opened; keeps the reply code and text of the step that failed.
 */
@Getter
public class SmtpSessionOpenException extends RuntimeException {
    private final int statusCode;
    private final String originalMessage;
    private final String target;

    public SmtpSessionOpenException(int statusCode, String originalMessage, String target) {
        super("SMTP session to " + target + " could not be opened: " + originalMessage);
        this.statusCode = statusCode;
        this.originalMessage = originalMessage;
        this.target = target;
    }
}
