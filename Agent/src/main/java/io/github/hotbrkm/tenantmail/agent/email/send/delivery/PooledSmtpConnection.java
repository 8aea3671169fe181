package io.github.hotbrkm.tenantmail.agent.email.send.delivery;

import io.github.hotbrkm.tenantmail.agent.email.send.result.SendResult;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.network.HostAndPort;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpClient;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpCommandResponse;
import io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp.SmtpStatus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * An open SMTP session borrowed from {@link SmtpConnectionPool}. Closing it hands it back to the pool.
 * Every transaction ends with RSET so no envelope state survives into the next borrower's transaction.
 */
@Slf4j
public class PooledSmtpConnection implements AutoCloseable {

    private final SmtpConnectionPool pool;
    private final SmtpClient client;
    @Getter
    private final HostAndPort target;

    @Getter
    private int messagesSent;
    private boolean broken;
    private boolean released;

    PooledSmtpConnection(SmtpConnectionPool pool, SmtpClient client, HostAndPort target) {
        this.pool = pool;
        this.client = client;
        this.target = target;
    }

    /**
     * Runs one MAIL FROM / RCPT TO / DATA transaction. All recipients must be accepted for the send to succeed.
     */
    public SendResult send(String envelopeFrom, List<String> recipients, String content) {
        if (recipients == null || recipients.isEmpty()) {
            return SendResult.failure(SmtpStatus.SESSION_INVALID, "No recipients");
        }

        SmtpCommandResponse mailFrom = client.sendMailFrom(envelopeFrom);
        if (!mailFrom.isSuccess()) {
            return failAndReset(mailFrom);
        }

        for (String recipient : recipients) {
            SmtpCommandResponse rcptTo = client.sendRcptTo(recipient);
            if (!rcptTo.isSuccess()) {
                return failAndReset(rcptTo);
            }
        }

        SmtpCommandResponse data = client.sendData();
        if (!data.isSuccess()) {
            return failAndReset(data);
        }

        SmtpCommandResponse dataEnd = client.sendMessage(content);
        if (!dataEnd.isSuccess()) {
            return failAndReset(dataEnd);
        }

        messagesSent++;
        reset();
        return SendResult.success(dataEnd.getStatusCode());
    }

    private SendResult failAndReset(SmtpCommandResponse response) {
        int statusCode = response.getStatusCode();
        if (SmtpStatus.isConnectionBroken(statusCode)) {
            broken = true;
        } else {
            reset();
        }
        return SendResult.failure(statusCode, response.getOriginalMessage());
    }

    private void reset() {
        SmtpCommandResponse rset = client.sendRset();
        if (!rset.isSuccess()) {
            log.debug("RSET rejected, connection will be discarded. target={}, response={}", target,
                    rset.getOriginalMessage());
            broken = true;
        }
    }

    /**
     * Sends NOOP to check that an idle session is still alive.
     */
    boolean probe() {
        if (!client.isSessionValid()) {
            return false;
        }
        boolean alive = client.sendNoop().isSuccess();
        if (!alive) {
            broken = true;
        }
        return alive;
    }

    boolean isReusable(int maxMessagesPerConnection) {
        return !broken && messagesSent < maxMessagesPerConnection && client.isSessionValid();
    }

    void markBorrowed() {
        released = false;
    }

    void quitAndClose() {
        try {
            if (!broken && client.isSessionValid()) {
                client.sendQuit();
            }
        } finally {
            client.close();
        }
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        pool.release(this);
    }
}
