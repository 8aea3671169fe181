package io.github.hotbrkm.tenantmail.agent.email.tenant.store;

import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local tenant store for development mode and tests.
 */
@Slf4j
public class InMemoryTenantStore implements TenantDirectory, TenantActivityLog {

    private final Map<Long, TenantAccount> tenants = new ConcurrentHashMap<>();
    private final Map<Long, String> activePlans = new ConcurrentHashMap<>();
    private final Map<Long, List<DomainRecord>> domains = new ConcurrentHashMap<>();
    private final Map<Long, TenantSettings> settings = new ConcurrentHashMap<>();
    private final Map<Long, List<EmailOutcomeRecord>> outcomes = new ConcurrentHashMap<>();
    private final Map<Long, List<Instant>> apiCalls = new ConcurrentHashMap<>();
    private final Map<Long, AtomicLong> activeWebhooks = new ConcurrentHashMap<>();
    private final Map<Long, AtomicLong> storageUsed = new ConcurrentHashMap<>();

    public void putTenant(TenantAccount account) {
        Objects.requireNonNull(account, "account must not be null");
        tenants.put(account.tenantId(), account);
    }

    public void putActivePlan(long tenantId, String planType) {
        activePlans.put(tenantId, planType);
    }

    public void putDomain(long tenantId, DomainRecord domainRecord) {
        Objects.requireNonNull(domainRecord, "domainRecord must not be null");
        List<DomainRecord> records = domains.computeIfAbsent(tenantId, id -> new CopyOnWriteArrayList<>());
        records.removeIf(it -> it.domainName().equalsIgnoreCase(domainRecord.domainName()));
        records.add(domainRecord);
    }

    public void putSettings(long tenantId, TenantSettings tenantSettings) {
        settings.put(tenantId, tenantSettings);
    }

    public void recordApiCall(long tenantId, Instant at) {
        apiCalls.computeIfAbsent(tenantId, id -> new CopyOnWriteArrayList<>()).add(at);
    }

    public void setActiveWebhooks(long tenantId, long count) {
        activeWebhooks.computeIfAbsent(tenantId, id -> new AtomicLong()).set(count);
    }

    public void setStorageUsedMegabytes(long tenantId, long megabytes) {
        storageUsed.computeIfAbsent(tenantId, id -> new AtomicLong()).set(megabytes);
    }

    public List<EmailOutcomeRecord> outcomes(long tenantId) {
        return List.copyOf(outcomes.getOrDefault(tenantId, List.of()));
    }

    @Override
    public Optional<TenantAccount> findTenant(long tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public Optional<String> findActivePlan(long tenantId) {
        return Optional.ofNullable(activePlans.get(tenantId));
    }

    @Override
    public List<DomainRecord> findDomains(long tenantId) {
        return new ArrayList<>(domains.getOrDefault(tenantId, List.of()));
    }

    @Override
    public Optional<TenantSettings> findSettings(long tenantId) {
        return Optional.ofNullable(settings.get(tenantId));
    }

    @Override
    public void touchLastActivity(long tenantId, Instant at) {
        tenants.computeIfPresent(tenantId, (id, account) ->
                new TenantAccount(id, account.verified(), account.suspended(), account.planType(), at));
    }

    @Override
    public long countEmailsSince(long tenantId, Instant since) {
        return outcomes.getOrDefault(tenantId, List.of()).stream()
                .filter(it -> it.outcome() == DeliveryOutcome.DELIVERED)
                .filter(it -> !it.recordedAt().isBefore(since))
                .count();
    }

    @Override
    public long countTotalEmails(long tenantId) {
        return outcomes.getOrDefault(tenantId, List.of()).stream()
                .filter(it -> it.outcome() == DeliveryOutcome.DELIVERED)
                .count();
    }

    @Override
    public long countApiCallsSince(long tenantId, Instant since) {
        return apiCalls.getOrDefault(tenantId, List.of()).stream()
                .filter(at -> !at.isBefore(since))
                .count();
    }

    @Override
    public long countActiveWebhooks(long tenantId) {
        AtomicLong count = activeWebhooks.get(tenantId);
        return count == null ? 0L : count.get();
    }

    @Override
    public long storageUsedMegabytes(long tenantId) {
        AtomicLong used = storageUsed.get(tenantId);
        return used == null ? 0L : used.get();
    }

    @Override
    public void recordEmailOutcome(EmailOutcomeRecord outcomeRecord) {
        outcomes.computeIfAbsent(outcomeRecord.tenantId(), id -> new CopyOnWriteArrayList<>()).add(outcomeRecord);
        log.debug("Recorded email outcome. tenantId={}, jobId={}, outcome={}",
                outcomeRecord.tenantId(), outcomeRecord.jobId(), outcomeRecord.outcome());
    }
}
