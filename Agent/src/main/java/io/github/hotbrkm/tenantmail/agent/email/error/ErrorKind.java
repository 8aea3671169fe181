package io.github.hotbrkm.tenantmail.agent.email.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure taxonomy shared by the tenant context provider, the queue manager and the email job processor.
 * <p>
 * {@code retryable} is the default queue decision for the kind. {@code operatorAlert} marks kinds that
 * indicate misconfiguration and must be escalated instead of retried.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {
    TENANT_NOT_FOUND("TenantNotFound", false, false),
    TENANT_INACTIVE("TenantInactive", false, false),
    TENANT_CONTEXT_UNAVAILABLE("TenantContextUnavailable", true, false),
    DOMAIN_NOT_OWNED("DomainNotOwned", false, false),
    RATE_LIMIT_EXCEEDED("RateLimitExceeded", false, false),
    DKIM_CONFIG_MISSING("DKIMConfigMissing", false, true),
    DKIM_CONFIG_CORRUPTED("DKIMConfigCorrupted", false, true),
    INVALID_KEY_MATERIAL("InvalidKeyMaterial", false, true),
    SIGNING_FAILED("SigningFailed", false, true),
    NO_MX_RECORDS("NoMXRecords", true, false),
    ALL_EXCHANGERS_FAILED("AllExchangersFailed", true, false),
    JOB_REJECTED("JobRejected", false, false);

    private final String code;
    private final boolean retryable;
    private final boolean operatorAlert;
}
