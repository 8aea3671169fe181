package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum SmtpCommand {
    CONNECT("CONNECT", 250),
    INIT("INIT", 220),
    HELO("HELO", 250),
    EHLO("EHLO", 250),
    STARTTLS("STARTTLS", 220),
    MAIL_FROM("MAIL FROM:", 250),
    RCPT_TO("RCPT TO:", 250),
    DATA("DATA", 354),
    DATA_END("DATA_END", 250),
    RSET("RSET", 250),
    NOOP("NOOP", 250),
    QUIT("QUIT", 221);

    private final String command;
    private final int successCode;

    public String buildMessage(String argument) {
        if (argument == null || argument.isEmpty()) {
            return command;
        }

        // MAIL FROM: and RCPT TO: end with a colon and take the path without a space
        if (command.endsWith(":")) {
            return command + argument;
        }

        return command + " " + argument;
    }

    /**
     * RCPT TO also accepts 251 (user not local, will forward).
     */
    public boolean isSuccess(int statusCode) {
        if (this == RCPT_TO) {
            return statusCode == 250 || statusCode == 251;
        }
        return statusCode == successCode;
    }

    @Override
    public String toString() {
        return command;
    }
}
