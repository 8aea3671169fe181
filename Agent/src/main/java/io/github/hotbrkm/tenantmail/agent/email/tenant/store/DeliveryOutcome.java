package io.github.hotbrkm.tenantmail.agent.email.tenant.store;

public enum DeliveryOutcome {
    DELIVERED, FAILED;

    public String label() {
        return name().toLowerCase();
    }
}
