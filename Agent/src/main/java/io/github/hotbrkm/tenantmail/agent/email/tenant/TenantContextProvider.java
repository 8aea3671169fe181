package io.github.hotbrkm.tenantmail.agent.email.tenant;

import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.support.CallTimeoutException;
import io.github.hotbrkm.tenantmail.agent.email.support.TimeLimitedExecutor;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.DomainRecord;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantAccount;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantActivityLog;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantDirectory;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves tenant ids into {@link TenantContext} snapshots and authorizes tenant operations.
 * <p>
 * Snapshots are cached per tenant for a bounded TTL. Every load takes a version number before it reads
 * the store and publishes its snapshot with a single {@code compute} on the cache entry, which keeps the
 * newer version if one is already there. {@link #invalidate(long)} publishes an empty marker with a fresh
 * version, so a load that started before the invalidation cannot resurrect stale data.
 */
@Slf4j
public class TenantContextProvider implements AutoCloseable {

    private final TenantDirectory directory;
    private final TenantActivityLog activityLog;
    private final Duration ttl;
    private final Duration loadTimeout;
    private final ZoneId defaultZone;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final TimeLimitedExecutor loader;

    private final ConcurrentHashMap<Long, CachedContext> cache = new ConcurrentHashMap<>();
    private final AtomicLong versionSequence = new AtomicLong();

    public TenantContextProvider(TenantDirectory directory, TenantActivityLog activityLog, Duration ttl,
                                 Duration loadTimeout, ZoneId defaultZone, Clock clock, MeterRegistry meterRegistry) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.activityLog = Objects.requireNonNull(activityLog, "activityLog must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.loadTimeout = Objects.requireNonNull(loadTimeout, "loadTimeout must not be null");
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.meterRegistry = meterRegistry == null ? new SimpleMeterRegistry() : meterRegistry;
        this.loader = new TimeLimitedExecutor("tenant-context-loader");
    }

    public TenantContext getContext(long tenantId) {
        return getContext(tenantId, false);
    }

    /**
     * Returns the cached snapshot while it is younger than the TTL, otherwise loads a new one.
     *
     * @throws TenantMailException {@code TENANT_NOT_FOUND} when the tenant does not exist,
     *                             {@code TENANT_CONTEXT_UNAVAILABLE} when the store cannot be read in time
     */
    public TenantContext getContext(long tenantId, boolean forceRefresh) {
        if (!forceRefresh) {
            CachedContext cached = cache.get(tenantId);
            if (cached != null && cached.isFresh(clock.instant(), ttl)) {
                return cached.context();
            }
        }

        long version = versionSequence.incrementAndGet();
        TenantContext loaded = load(tenantId, version);
        Instant cachedAt = clock.instant();
        CachedContext published = cache.compute(tenantId, (id, current) ->
                current != null && current.version() > version ? current : new CachedContext(loaded, version, cachedAt));

        if (published.context() != null && published.version() > version) {
            return published.context();
        }
        return loaded;
    }

    public TenantContext refresh(long tenantId) {
        return getContext(tenantId, true);
    }

    public void invalidate(long tenantId) {
        long version = versionSequence.incrementAndGet();
        cache.put(tenantId, new CachedContext(null, version, clock.instant()));
        log.debug("Tenant context invalidated. tenantId={}", tenantId);
    }

    public void invalidateAll() {
        List<Long> tenantIds = new ArrayList<>(cache.keySet());
        tenantIds.forEach(this::invalidate);
        log.info("Tenant context cache invalidated. tenants={}", tenantIds.size());
    }

    public OperationValidation validateOperation(long tenantId, TenantOperation operation) {
        return validateOperation(tenantId, OperationRequest.of(operation));
    }

    /**
     * Authorizes an operation against the tenant's plan. Never throws for expected outcomes: unknown
     * tenants, inactive tenants and store failures all come back as a denial.
     */
    public OperationValidation validateOperation(long tenantId, OperationRequest request) {
        try {
            TenantContext context = getContext(tenantId);
            if (!context.active()) {
                return OperationValidation.deny(DenialReason.TENANT_INACTIVE, "Tenant " + tenantId + " is not active");
            }

            return switch (request.operation()) {
                case SEND_EMAIL -> validateSendEmail(context, request.resource());
                case ADD_DOMAIN -> validateAddDomain(context);
                case CREATE_WEBHOOK -> validateCreateWebhook(context);
                case API_CALL -> validateApiCall(context);
                case USE_STORAGE -> validateUseStorage(context, request.quantity());
            };
        } catch (TenantMailException e) {
            if (e.getKind() == ErrorKind.TENANT_NOT_FOUND) {
                return OperationValidation.deny(DenialReason.TENANT_NOT_FOUND, e.getMessage());
            }
            log.error("Operation validation failed. tenantId={}, operation={}", tenantId,
                    request.operation().getOperationName(), e);
            return OperationValidation.deny(DenialReason.INTERNAL, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Operation validation failed. tenantId={}, operation={}", tenantId,
                    request.operation().getOperationName(), e);
            return OperationValidation.deny(DenialReason.INTERNAL, "Validation error: " + e.getMessage());
        }
    }

    public TenantUsage getUsage(long tenantId) {
        TenantContext context = getContext(tenantId);
        ZonedDateTime now = clock.instant().atZone(context.settings().timezone());
        Instant startOfDay = now.toLocalDate().atStartOfDay(now.getZone()).toInstant();
        Instant startOfMonth = now.toLocalDate().withDayOfMonth(1).atStartOfDay(now.getZone()).toInstant();
        return new TenantUsage(tenantId,
                activityLog.countEmailsSince(tenantId, startOfDay),
                activityLog.countEmailsSince(tenantId, startOfMonth),
                activityLog.countTotalEmails(tenantId));
    }

    /**
     * Stamps the tenant's last activity. Failures are logged and dropped.
     */
    public void recordActivity(long tenantId) {
        try {
            directory.touchLastActivity(tenantId, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to update last activity. tenantId={}", tenantId, e);
        }
    }

    @Override
    public void close() {
        loader.close();
    }

    private OperationValidation validateSendEmail(TenantContext context, String senderDomain) {
        if (senderDomain == null || senderDomain.isBlank()) {
            return OperationValidation.deny(DenialReason.MISSING_RESOURCE, "Sender domain is required for send_email");
        }
        if (!context.ownsDomain(senderDomain)) {
            return OperationValidation.deny(DenialReason.DOMAIN_NOT_OWNED,
                    "Domain " + senderDomain + " is not verified for tenant " + context.tenantId());
        }

        long tenantId = context.tenantId();
        Instant now = clock.instant();
        ZonedDateTime zonedNow = now.atZone(context.settings().timezone());
        Instant startOfDay = zonedNow.toLocalDate().atStartOfDay(zonedNow.getZone()).toInstant();

        long sentToday = activityLog.countEmailsSince(tenantId, startOfDay);
        int dailyLimit = context.planLimits().emailsPerDay();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sentToday", sentToday);
        metadata.put("dailyLimit", dailyLimit);
        metadata.put("remaining", Math.max(0L, dailyLimit - sentToday));

        if (sentToday >= dailyLimit) {
            return OperationValidation.deny(DenialReason.DAILY_LIMIT,
                    "Daily send limit reached (" + sentToday + "/" + dailyLimit + ")", metadata);
        }

        long sentThisHour = activityLog.countEmailsSince(tenantId, now.minus(1, ChronoUnit.HOURS));
        int hourlyLimit = context.rateLimits().perHour();
        metadata.put("sentThisHour", sentThisHour);
        metadata.put("hourlyLimit", hourlyLimit);

        if (sentThisHour >= hourlyLimit) {
            return OperationValidation.deny(DenialReason.HOURLY_LIMIT,
                    "Hourly send limit reached (" + sentThisHour + "/" + hourlyLimit + ")", metadata);
        }

        long sentThisMinute = activityLog.countEmailsSince(tenantId, now.minus(1, ChronoUnit.MINUTES));
        int minuteLimit = context.rateLimits().perMinute();
        metadata.put("sentThisMinute", sentThisMinute);
        metadata.put("minuteLimit", minuteLimit);

        if (sentThisMinute >= minuteLimit) {
            return OperationValidation.deny(DenialReason.MINUTE_LIMIT,
                    "Per-minute send limit reached (" + sentThisMinute + "/" + minuteLimit + ")", metadata);
        }

        return OperationValidation.allow(metadata);
    }

    private OperationValidation validateAddDomain(TenantContext context) {
        long current = context.verifiedDomainCount();
        int limit = context.planLimits().domains();
        Map<String, Object> metadata = Map.of("currentDomains", current, "domainsLimit", limit);
        if (current >= limit) {
            return OperationValidation.deny(DenialReason.DOMAIN_LIMIT,
                    "Domain limit reached (" + current + "/" + limit + ")", metadata);
        }
        return OperationValidation.allow(metadata);
    }

    private OperationValidation validateCreateWebhook(TenantContext context) {
        long current = activityLog.countActiveWebhooks(context.tenantId());
        int limit = context.planLimits().webhooks();
        Map<String, Object> metadata = Map.of("currentWebhooks", current, "webhooksLimit", limit);
        if (current >= limit) {
            return OperationValidation.deny(DenialReason.WEBHOOK_LIMIT,
                    "Webhook limit reached (" + current + "/" + limit + ")", metadata);
        }
        return OperationValidation.allow(metadata);
    }

    private OperationValidation validateApiCall(TenantContext context) {
        long current = activityLog.countApiCallsSince(context.tenantId(), clock.instant().minus(1, ChronoUnit.HOURS));
        int limit = context.planLimits().apiCallsPerHour();
        Map<String, Object> metadata = Map.of("apiCallsThisHour", current, "apiCallsLimit", limit);
        if (current >= limit) {
            return OperationValidation.deny(DenialReason.API_CALL_LIMIT,
                    "API call limit reached (" + current + "/" + limit + ")", metadata);
        }
        return OperationValidation.allow(metadata);
    }

    private OperationValidation validateUseStorage(TenantContext context, long requestedMegabytes) {
        long used = activityLog.storageUsedMegabytes(context.tenantId());
        int limit = context.planLimits().storageMegabytes();
        Map<String, Object> metadata = Map.of("storageUsedMb", used, "storageLimitMb", limit,
                "requestedMb", requestedMegabytes);
        if (used + requestedMegabytes > limit) {
            return OperationValidation.deny(DenialReason.STORAGE_LIMIT,
                    "Storage limit exceeded (" + (used + requestedMegabytes) + "/" + limit + " MB)", metadata);
        }
        return OperationValidation.allow(metadata);
    }

    private TenantContext load(long tenantId, long version) {
        try {
            TenantContext context = loader.call("tenant-context:" + tenantId, () -> assemble(tenantId, version), loadTimeout);
            meterRegistry.counter("tenantmail.tenant.context.load", "result", "loaded").increment();
            log.debug("Tenant context loaded. tenantId={}, version={}, plan={}, domains={}", tenantId, version,
                    context.planTier().getPlanName(), context.verifiedDomains().size());
            return context;
        } catch (TenantMailException e) {
            meterRegistry.counter("tenantmail.tenant.context.load", "result", "not_found").increment();
            throw e;
        } catch (CallTimeoutException e) {
            meterRegistry.counter("tenantmail.tenant.context.load", "result", "timeout").increment();
            throw new TenantMailException(ErrorKind.TENANT_CONTEXT_UNAVAILABLE,
                    "Tenant context load timed out. tenantId=" + tenantId, e);
        } catch (RuntimeException e) {
            meterRegistry.counter("tenantmail.tenant.context.load", "result", "failed").increment();
            throw new TenantMailException(ErrorKind.TENANT_CONTEXT_UNAVAILABLE,
                    "Tenant context load failed. tenantId=" + tenantId, e);
        }
    }

    private TenantContext assemble(long tenantId, long version) {
        TenantAccount account = directory.findTenant(tenantId)
                .orElseThrow(() -> new TenantMailException(ErrorKind.TENANT_NOT_FOUND, "Tenant not found. tenantId=" + tenantId));

        PlanTier planTier = resolvePlan(account);
        TenantSettings settings = resolveSettings(tenantId);
        List<DomainRecord> domainRecords = directory.findDomains(tenantId);

        List<VerifiedDomain> verifiedDomains = new ArrayList<>();
        List<DkimConfiguration> dkimConfigurations = new ArrayList<>();
        for (DomainRecord domain : domainRecords) {
            verifiedDomains.add(new VerifiedDomain(domain.domainName(), domain.verified(), domain.spfVerified(),
                    domain.dkimVerified(), domain.dmarcVerified(), domain.dkimSelector(), domain.verifiedAt()));

            // Incomplete material stays in the snapshot so signing can reject it as corrupted.
            if (domain.verified() && domain.hasKeyMaterial()) {
                dkimConfigurations.add(new DkimConfiguration(domain.domainId(), domain.domainName(), domain.dkimSelector(),
                        domain.dkimPrivateKey(), domain.dkimPublicKey(), domain.dkimVerified()));
            }
        }

        return new TenantContext(tenantId, planTier, planTier.getPlanLimits(), planTier.getRateLimits(), verifiedDomains,
                dkimConfigurations, settings, account.isActive(), account.lastActivityAt(), clock.instant(), version);
    }

    private PlanTier resolvePlan(TenantAccount account) {
        try {
            return directory.findActivePlan(account.tenantId())
                    .map(PlanTier::fromName)
                    .orElseGet(() -> PlanTier.fromName(account.planType()));
        } catch (TenantStoreException e) {
            log.warn("Plan lookup unavailable, using account plan. tenantId={}, planType={}, cause={}",
                    account.tenantId(), account.planType(), e.getMessage());
            return PlanTier.fromName(account.planType());
        }
    }

    private TenantSettings resolveSettings(long tenantId) {
        try {
            return directory.findSettings(tenantId).orElseGet(() -> TenantSettings.defaults(defaultZone));
        } catch (TenantStoreException e) {
            log.warn("Tenant settings unavailable, using defaults. tenantId={}, cause={}", tenantId, e.getMessage());
            return TenantSettings.defaults(defaultZone);
        }
    }

    private record CachedContext(TenantContext context, long version, Instant cachedAt) {

        boolean isFresh(Instant now, Duration ttl) {
            return context != null && cachedAt.plus(ttl).isAfter(now);
        }
    }
}
