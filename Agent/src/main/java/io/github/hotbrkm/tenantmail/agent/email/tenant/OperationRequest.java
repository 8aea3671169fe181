package io.github.hotbrkm.tenantmail.agent.email.tenant;

import java.util.Objects;

/**
 * Operation to authorize. {@code resource} is the sender domain for {@link TenantOperation#SEND_EMAIL};
 * {@code quantity} is the requested megabytes for {@link TenantOperation#USE_STORAGE}.
 */
public record OperationRequest(TenantOperation operation, String resource, long quantity) {

    public OperationRequest {
        Objects.requireNonNull(operation, "operation must not be null");
    }

    public static OperationRequest of(TenantOperation operation) {
        return new OperationRequest(operation, null, 0L);
    }

    public static OperationRequest sendEmail(String senderDomain) {
        return new OperationRequest(TenantOperation.SEND_EMAIL, senderDomain, 1L);
    }

    public static OperationRequest useStorage(long megabytes) {
        return new OperationRequest(TenantOperation.USE_STORAGE, null, megabytes);
    }
}
