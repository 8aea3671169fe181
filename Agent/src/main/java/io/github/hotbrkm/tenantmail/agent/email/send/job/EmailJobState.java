package io.github.hotbrkm.tenantmail.agent.email.send.job;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EmailJobState {
    QUEUED("queued"),
    CONTEXT_VALIDATED("context_validated"),
    DOMAIN_AUTHORIZED("domain_authorized"),
    RATE_CHECKED("rate_checked"),
    DKIM_VALIDATED("dkim_validated"),
    SIGNED("signed"),
    DELIVERED("delivered"),
    FAILED("failed");

    private final String label;

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED;
    }
}
