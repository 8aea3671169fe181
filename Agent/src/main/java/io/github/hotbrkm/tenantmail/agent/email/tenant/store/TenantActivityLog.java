package io.github.hotbrkm.tenantmail.agent.email.tenant.store;

import java.time.Instant;

/**
 * Persisted send log and usage counters. Email counts only include delivered messages.
 * <p>
 * Quota checks read these counts and the processor appends to the log afterwards, so two jobs of the
 * same tenant running at the same time can both pass a check that only one of them should have passed.
 * Implementations that need a hard ceiling must increment-and-check atomically in the store.
 */
public interface TenantActivityLog {

    long countEmailsSince(long tenantId, Instant since);

    long countTotalEmails(long tenantId);

    long countApiCallsSince(long tenantId, Instant since);

    long countActiveWebhooks(long tenantId);

    long storageUsedMegabytes(long tenantId);

    void recordEmailOutcome(EmailOutcomeRecord outcomeRecord);
}
