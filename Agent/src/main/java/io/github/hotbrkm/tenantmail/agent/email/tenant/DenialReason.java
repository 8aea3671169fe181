package io.github.hotbrkm.tenantmail.agent.email.tenant;

import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why {@link TenantContextProvider#validateOperation} denied an operation, and the failure kind a job
 * terminates with when it hits that denial.
 */
@Getter
@RequiredArgsConstructor
public enum DenialReason {
    TENANT_NOT_FOUND(ErrorKind.TENANT_NOT_FOUND),
    TENANT_INACTIVE(ErrorKind.TENANT_INACTIVE),
    DOMAIN_NOT_OWNED(ErrorKind.DOMAIN_NOT_OWNED),
    DAILY_LIMIT(ErrorKind.RATE_LIMIT_EXCEEDED),
    HOURLY_LIMIT(ErrorKind.RATE_LIMIT_EXCEEDED),
    MINUTE_LIMIT(ErrorKind.RATE_LIMIT_EXCEEDED),
    DOMAIN_LIMIT(ErrorKind.JOB_REJECTED),
    WEBHOOK_LIMIT(ErrorKind.JOB_REJECTED),
    API_CALL_LIMIT(ErrorKind.JOB_REJECTED),
    STORAGE_LIMIT(ErrorKind.JOB_REJECTED),
    MISSING_RESOURCE(ErrorKind.JOB_REJECTED),
    INTERNAL(ErrorKind.TENANT_CONTEXT_UNAVAILABLE);

    private final ErrorKind errorKind;

    public boolean isSendRateLimit() {
        return this == DAILY_LIMIT || this == HOURLY_LIMIT || this == MINUTE_LIMIT;
    }
}
