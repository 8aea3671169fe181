package io.github.hotbrkm.tenantmail.agent.email.tenant.store;

import java.time.Instant;
import java.util.List;

public record EmailOutcomeRecord(long tenantId,
                                 String jobId,
                                 String messageId,
                                 String from,
                                 List<String> to,
                                 DeliveryOutcome outcome,
                                 String mxUsed,
                                 String errorCode,
                                 String errorMessage,
                                 Instant recordedAt) {

    public EmailOutcomeRecord {
        to = to == null ? List.of() : List.copyOf(to);
    }
}
