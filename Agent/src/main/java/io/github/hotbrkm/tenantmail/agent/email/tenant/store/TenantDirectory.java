package io.github.hotbrkm.tenantmail.agent.email.tenant.store;

import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantSettings;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read contract of the durable tenant store.
 * <p>
 * {@link #findActivePlan} and {@link #findSettings} read optional tables; they may throw
 * {@link TenantStoreException} and callers degrade to defaults when they do.
 */
public interface TenantDirectory {

    Optional<TenantAccount> findTenant(long tenantId);

    Optional<String> findActivePlan(long tenantId);

    List<DomainRecord> findDomains(long tenantId);

    Optional<TenantSettings> findSettings(long tenantId);

    void touchLastActivity(long tenantId, Instant at);
}
