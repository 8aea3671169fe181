package io.github.hotbrkm.tenantmail.agent.email.support;

import lombok.Getter;

import java.time.Duration;

@Getter
public class CallTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public CallTimeoutException(String operation, Duration timeout) {
        super(operation + " did not complete within " + timeout.toMillis() + " ms");
        this.operation = operation;
        this.timeout = timeout;
    }
}
