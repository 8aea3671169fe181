package io.github.hotbrkm.tenantmail.agent.email.error;

import lombok.Getter;

import java.util.Objects;

/**
 * Root of every failure raised by the delivery core. The queue consults {@link #isRetryable()} to decide
 * between scheduling another attempt and failing the job.
 */
@Getter
public class TenantMailException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;

    public TenantMailException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public TenantMailException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.isRetryable(), cause);
    }

    public TenantMailException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.retryable = retryable;
    }

    public String getCode() {
        return kind.getCode();
    }
}
