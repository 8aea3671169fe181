package io.github.hotbrkm.tenantmail.agent.email.tenant.store;

/**
 * Raised by store implementations when a table or backing service cannot be read.
 */
public class TenantStoreException extends RuntimeException {

    public TenantStoreException(String message) {
        super(message);
    }

    public TenantStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
