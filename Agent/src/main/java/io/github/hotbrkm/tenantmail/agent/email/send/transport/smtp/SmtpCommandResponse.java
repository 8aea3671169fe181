package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import lombok.Getter;

import java.util.List;

@Getter
public class SmtpCommandResponse {
    private final SmtpCommand command;
    private final SmtpResponse response;

    public SmtpCommandResponse(SmtpCommand command, List<String> responseLines) {
        this.command = command;
        this.response = SmtpResponseParser.parseResponse(responseLines);
    }

    public boolean isSuccess() {
        return command.isSuccess(response.statusCode());
    }

    public String getOriginalMessage() {
        return response.originalMessage();
    }

    public boolean contains(String keyword) {
        return response.contains(keyword);
    }

    public int getStatusCode() {
        return response.statusCode();
    }

    public String getMessage() {
        return response.message();
    }

    @Override
    public String toString() {
        return "Command: " + command + ", Response: " + response;
    }
}
