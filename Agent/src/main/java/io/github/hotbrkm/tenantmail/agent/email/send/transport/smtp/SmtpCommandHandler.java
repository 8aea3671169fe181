package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpCommand.*;

/**
 * Writes SMTP commands and reads their replies. Transport failures are turned into local reply codes
 * (703 I/O error, 704 read timeout) so callers only ever branch on {@link SmtpCommandResponse}.
 */
@Slf4j
public class SmtpCommandHandler {
    private static final int MAX_HISTORY = 64;

    private final SmtpSession session;
    private final List<SmtpCommandResponse> responses = new ArrayList<>();
    private boolean greeted;
    private boolean quitSent;

    @Setter
    @Getter
    private boolean traceLog = false;

    public SmtpCommandHandler(SmtpSession session) {
        this.session = session;
    }

    public SmtpCommandResponse readInitResponse() {
        return execute(INIT, null);
    }

    public SmtpCommandResponse sendEhloOrHelo(String helo) {
        SmtpCommandResponse ehloResponse = sendEhlo(helo);
        return ehloResponse.isSuccess() ? ehloResponse : sendHelo(helo);
    }

    public SmtpCommandResponse sendEhlo(String helo) {
        return execute(EHLO, EHLO.buildMessage(helo));
    }

    public SmtpCommandResponse sendHelo(String helo) {
        return execute(HELO, HELO.buildMessage(helo));
    }

    public SmtpCommandResponse sendStartTls() {
        return execute(STARTTLS, STARTTLS.getCommand());
    }

    public SmtpCommandResponse sendMailFrom(String mailFrom) {
        return execute(MAIL_FROM, MAIL_FROM.buildMessage("<" + mailFrom + ">"));
    }

    public SmtpCommandResponse sendRcptTo(String rcptTo) {
        return execute(RCPT_TO, RCPT_TO.buildMessage("<" + rcptTo + ">"));
    }

    public SmtpCommandResponse sendData() {
        return execute(DATA, DATA.getCommand());
    }

    /**
     * Sends the message body after a 354 reply to DATA and reads the final reply (expects 250).
     * Lines starting with a dot are dot-stuffed.
     */
    public SmtpCommandResponse sendMessage(String message) {
        String body = dotStuff(message);
        String terminator = body.endsWith("\r\n") ? "." : "\r\n.";
        return execute(DATA_END, body + terminator);
    }

    public SmtpCommandResponse sendRset() {
        return execute(RSET, RSET.getCommand());
    }

    public SmtpCommandResponse sendNoop() {
        return execute(NOOP, NOOP.getCommand());
    }

    public SmtpCommandResponse sendQuit() {
        return execute(QUIT, QUIT.getCommand());
    }

    private SmtpCommandResponse execute(SmtpCommand command, String line) {
        SmtpCommandResponse response = new SmtpCommandResponse(command, sendCommand(command, line));
        addSmtpCommandResponse(response);
        return response;
    }

    private List<String> sendCommand(SmtpCommand command, String line) {
        List<String> responseLines = new ArrayList<>();

        try {
            writeMessage(command, line);
            readAllMessages(responseLines);
        } catch (InterruptedIOException e) {
            responseLines.add(SmtpStatus.READ_TIMEOUT + " SMTP " + command + " " + e);
        } catch (IOException e) {
            responseLines.add(SmtpStatus.IO_ERROR + " SMTP " + command + " " + e);
        }
        return responseLines;
    }

    private void writeMessage(SmtpCommand command, String line) {
        if (line != null) {
            if (traceLog) {
                log.info("[Send Message]: {}", command == DATA_END ? "<message body>" : line);
            }
            session.writeMessage(line);
        }
    }

    private void readAllMessages(List<String> responseLines) throws IOException {
        String line;
        do {
            line = session.readLine();
            if (traceLog) {
                log.info("[Read Message]: {}", line);
            }

            if (line == null) {
                throw new IOException("null reply from server");
            }

            responseLines.add(line);
        } while ((line.length() > 3) && (line.charAt(3) == '-'));
    }

    static String dotStuff(String message) {
        if (message.startsWith(".") || message.contains("\n.")) {
            String stuffed = message.replace("\n.", "\n..");
            return stuffed.startsWith(".") ? "." + stuffed : stuffed;
        }
        return message;
    }

    public void addSmtpCommandResponse(SmtpCommandResponse response) {
        SmtpCommand command = response.getCommand();
        if (command == CONNECT || command == INIT || (command == STARTTLS && response.isSuccess())) {
            greeted = false;
        } else if ((command == HELO || command == EHLO) && response.isSuccess()) {
            greeted = true;
        } else if (command == QUIT) {
            quitSent = true;
        }

        if (responses.size() >= MAX_HISTORY) {
            responses.remove(0);
        }
        responses.add(response);
    }

    public void addResponse(SmtpCommand smtpCommand, String message) {
        addSmtpCommandResponse(new SmtpCommandResponse(smtpCommand, Collections.singletonList(message)));
    }

    /**
     * Returns the most recent reply line, or an empty string when nothing was exchanged yet.
     */
    public String getCurrentMessage() {
        if (responses.isEmpty()) {
            return "";
        }
        String message = responses.get(responses.size() - 1).getOriginalMessage();
        return message == null ? "" : message;
    }

    /**
     * A session is valid once HELO or EHLO succeeded on the current connection and QUIT has not been sent.
     */
    public boolean isValidSession() {
        return greeted && !quitSent;
    }
}
