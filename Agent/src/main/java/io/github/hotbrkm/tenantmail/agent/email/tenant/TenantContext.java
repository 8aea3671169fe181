package io.github.hotbrkm.tenantmail.agent.email.tenant;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of everything the delivery pipeline needs to know about one tenant.
 * A refresh produces a new snapshot with a higher {@code version}; snapshots are never mutated.
 */
public record TenantContext(long tenantId,
                            PlanTier planTier,
                            PlanLimits planLimits,
                            RateLimits rateLimits,
                            List<VerifiedDomain> verifiedDomains,
                            List<DkimConfiguration> dkimConfigurations,
                            TenantSettings settings,
                            boolean active,
                            Instant lastActivityAt,
                            Instant loadedAt,
                            long version) {

    public TenantContext {
        Objects.requireNonNull(planTier, "planTier must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        planLimits = planLimits == null ? planTier.getPlanLimits() : planLimits;
        rateLimits = rateLimits == null ? planTier.getRateLimits() : rateLimits;
        verifiedDomains = verifiedDomains == null ? List.of() : List.copyOf(verifiedDomains);
        dkimConfigurations = dkimConfigurations == null ? List.of() : List.copyOf(dkimConfigurations);
    }

    /**
     * True when the domain is listed with its verified flag set.
     */
    public boolean ownsDomain(String domain) {
        return findVerifiedDomain(domain).map(VerifiedDomain::verified).orElse(false);
    }

    public Optional<VerifiedDomain> findVerifiedDomain(String domain) {
        String normalized = normalize(domain);
        return verifiedDomains.stream()
                .filter(it -> normalize(it.domainName()).equals(normalized))
                .findFirst();
    }

    public Optional<DkimConfiguration> findActiveDkimConfiguration(String domain) {
        String normalized = normalize(domain);
        return dkimConfigurations.stream()
                .filter(DkimConfiguration::active)
                .filter(it -> normalize(it.domainName()).equals(normalized))
                .findFirst();
    }

    public List<String> configuredDomains() {
        return dkimConfigurations.stream()
                .filter(DkimConfiguration::active)
                .map(DkimConfiguration::domainName)
                .toList();
    }

    public List<String> verifiedDomainsWithoutDkim() {
        List<String> configured = configuredDomains().stream().map(TenantContext::normalize).toList();
        return verifiedDomains.stream()
                .filter(VerifiedDomain::verified)
                .map(VerifiedDomain::domainName)
                .filter(name -> !configured.contains(normalize(name)))
                .toList();
    }

    public long verifiedDomainCount() {
        return verifiedDomains.stream().filter(VerifiedDomain::verified).count();
    }

    private static String normalize(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }
}
