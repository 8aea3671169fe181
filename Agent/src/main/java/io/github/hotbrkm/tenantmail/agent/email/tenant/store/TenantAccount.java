package io.github.hotbrkm.tenantmail.agent.email.tenant.store;

import java.time.Instant;

public record TenantAccount(long tenantId, boolean verified, boolean suspended, String planType, Instant lastActivityAt) {

    public boolean isActive() {
        return verified && !suspended;
    }
}
