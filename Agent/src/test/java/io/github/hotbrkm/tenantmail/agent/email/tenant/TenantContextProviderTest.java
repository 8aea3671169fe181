package io.github.hotbrkm.tenantmail.agent.email.tenant;

import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import io.github.hotbrkm.tenantmail.agent.email.support.MutableClock;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.InMemoryTenantStore;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantAccount;
import io.github.hotbrkm.tenantmail.agent.email.tenant.store.TenantStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static io.github.hotbrkm.tenantmail.agent.email.tenant.TenantFixtures.DOMAIN;
import static io.github.hotbrkm.tenantmail.agent.email.tenant.TenantFixtures.NOW;
import static io.github.hotbrkm.tenantmail.agent.email.tenant.TenantFixtures.TENANT_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantContextProvider Test")
class TenantContextProviderTest {

    private MutableClock clock;
    private InMemoryTenantStore store;
    private TenantContextProvider provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, ZoneOffset.UTC);
        store = TenantFixtures.store(TENANT_ID, "free", TenantFixtures.signingDomain(1L, DOMAIN));
        provider = TenantFixtures.provider(store, clock);
    }

    @AfterEach
    void tearDown() {
        provider.close();
    }

    @Test
    @DisplayName("Builds a snapshot with plan limits, domains and signing material")
    void getContext_buildsSnapshot() {
        // When
        TenantContext context = provider.getContext(TENANT_ID);

        // Then
        assertThat(context.tenantId()).isEqualTo(TENANT_ID);
        assertThat(context.planTier()).isEqualTo(PlanTier.FREE);
        assertThat(context.rateLimits().perMinute()).isEqualTo(2);
        assertThat(context.active()).isTrue();
        assertThat(context.ownsDomain("ACME.test")).isTrue();
        assertThat(context.findActiveDkimConfiguration(DOMAIN)).isPresent();
        assertThat(context.settings().timezone()).isEqualTo(ZoneOffset.UTC);
        assertThat(context.loadedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Returns the cached snapshot within the TTL")
    void getContext_withinTtl_returnsCached() {
        // Given
        TenantContext first = provider.getContext(TENANT_ID);
        store.putActivePlan(TENANT_ID, "enterprise");
        clock.advance(Duration.ofMinutes(4));

        // When
        TenantContext second = provider.getContext(TENANT_ID);

        // Then
        assertThat(second).isSameAs(first);
        assertThat(second.planTier()).isEqualTo(PlanTier.FREE);
    }

    @Test
    @DisplayName("Reloads once the TTL has passed")
    void getContext_afterTtl_reloads() {
        // Given
        TenantContext first = provider.getContext(TENANT_ID);
        store.putActivePlan(TENANT_ID, "enterprise");
        clock.advance(Duration.ofMinutes(5));

        // When
        TenantContext second = provider.getContext(TENANT_ID);

        // Then
        assertThat(second.planTier()).isEqualTo(PlanTier.ENTERPRISE);
        assertThat(second.version()).isGreaterThan(first.version());
    }

    @Test
    @DisplayName("Refresh and invalidate bypass the cache")
    void refreshAndInvalidate_bypassCache() {
        // Given
        provider.getContext(TENANT_ID);
        store.putActivePlan(TENANT_ID, "pro");

        // When
        TenantContext refreshed = provider.refresh(TENANT_ID);
        store.putActivePlan(TENANT_ID, "enterprise");
        provider.invalidate(TENANT_ID);
        TenantContext afterInvalidate = provider.getContext(TENANT_ID);

        // Then
        assertThat(refreshed.planTier()).isEqualTo(PlanTier.PRO);
        assertThat(afterInvalidate.planTier()).isEqualTo(PlanTier.ENTERPRISE);
        assertThat(afterInvalidate.version()).isGreaterThan(refreshed.version());
    }

    @Test
    @DisplayName("Unknown tenant raises TenantNotFound")
    void getContext_unknownTenant_throws() {
        // When & Then
        assertThatThrownBy(() -> provider.getContext(999L))
                .isInstanceOf(TenantMailException.class)
                .satisfies(e -> assertThat(((TenantMailException) e).getKind()).isEqualTo(ErrorKind.TENANT_NOT_FOUND));
    }

    @Test
    @DisplayName("Unreadable store raises a retryable TenantContextUnavailable")
    void getContext_storeFailure_throwsRetryable() {
        // Given
        InMemoryTenantStore failing = new InMemoryTenantStore() {
            @Override
            public Optional<TenantAccount> findTenant(long tenantId) {
                throw new IllegalStateException("connection refused");
            }
        };
        TenantContextProvider failingProvider = TenantFixtures.provider(failing, clock);

        // When & Then
        try {
            assertThatThrownBy(() -> failingProvider.getContext(TENANT_ID))
                    .isInstanceOf(TenantMailException.class)
                    .satisfies(e -> {
                        TenantMailException mailException = (TenantMailException) e;
                        assertThat(mailException.getKind()).isEqualTo(ErrorKind.TENANT_CONTEXT_UNAVAILABLE);
                        assertThat(mailException.isRetryable()).isTrue();
                    });
        } finally {
            failingProvider.close();
        }
    }

    @Test
    @DisplayName("Optional tables that cannot be read fall back to the account plan and default settings")
    void getContext_optionalTablesFail_degrades() {
        // Given
        InMemoryTenantStore degraded = new InMemoryTenantStore() {
            @Override
            public Optional<String> findActivePlan(long tenantId) {
                throw new TenantStoreException("plans table missing");
            }

            @Override
            public Optional<TenantSettings> findSettings(long tenantId) {
                throw new TenantStoreException("settings table missing");
            }
        };
        degraded.putTenant(TenantFixtures.account(TENANT_ID, "pro"));
        TenantContextProvider degradedProvider = new TenantContextProvider(degraded, degraded, Duration.ofMinutes(5),
                Duration.ofSeconds(5), ZoneId.of("America/Sao_Paulo"), clock, new SimpleMeterRegistry());

        try {
            // When
            TenantContext context = degradedProvider.getContext(TENANT_ID);

            // Then
            assertThat(context.planTier()).isEqualTo(PlanTier.PRO);
            assertThat(context.settings().timezone()).isEqualTo(ZoneId.of("America/Sao_Paulo"));
        } finally {
            degradedProvider.close();
        }
    }

    @Test
    @DisplayName("Send is allowed for an owned domain under every limit")
    void validateOperation_sendEmail_allowed() {
        // When
        OperationValidation validation = provider.validateOperation(TENANT_ID, OperationRequest.sendEmail(DOMAIN));

        // Then
        assertThat(validation.allowed()).isTrue();
        assertThat(validation.metadata()).containsEntry("sentToday", 0L).containsEntry("dailyLimit", 100);
    }

    @Test
    @DisplayName("Validation never throws for unknown or inactive tenants")
    void validateOperation_unknownOrInactive_denied() {
        // Given
        store.putTenant(TenantFixtures.suspendedAccount(7L));

        // When
        OperationValidation unknown = provider.validateOperation(999L, TenantOperation.API_CALL);
        OperationValidation inactive = provider.validateOperation(7L, TenantOperation.API_CALL);

        // Then
        assertThat(unknown.allowed()).isFalse();
        assertThat(unknown.reason()).isEqualTo(DenialReason.TENANT_NOT_FOUND);
        assertThat(inactive.reason()).isEqualTo(DenialReason.TENANT_INACTIVE);
        assertThat(inactive.toException().getKind()).isEqualTo(ErrorKind.TENANT_INACTIVE);
    }

    @Test
    @DisplayName("Store failures come back as an internal denial")
    void validateOperation_storeFailure_internal() {
        // Given
        InMemoryTenantStore failing = new InMemoryTenantStore() {
            @Override
            public Optional<TenantAccount> findTenant(long tenantId) {
                throw new IllegalStateException("connection refused");
            }
        };
        TenantContextProvider failingProvider = TenantFixtures.provider(failing, clock);

        try {
            // When
            OperationValidation validation = failingProvider.validateOperation(TENANT_ID, OperationRequest.sendEmail(DOMAIN));

            // Then
            assertThat(validation.allowed()).isFalse();
            assertThat(validation.reason()).isEqualTo(DenialReason.INTERNAL);
            assertThat(validation.toException().isRetryable()).isTrue();
        } finally {
            failingProvider.close();
        }
    }

    @Test
    @DisplayName("Unverified or foreign sender domains are denied")
    void validateOperation_domainNotOwned_denied() {
        // Given
        store.putDomain(TENANT_ID, TenantFixtures.unverifiedDomain(2L, "pending.test"));

        // When
        OperationValidation pending = provider.validateOperation(TENANT_ID, OperationRequest.sendEmail("pending.test"));
        OperationValidation foreign = provider.validateOperation(TENANT_ID, OperationRequest.sendEmail("other.test"));
        OperationValidation missing = provider.validateOperation(TENANT_ID, OperationRequest.sendEmail(null));

        // Then
        assertThat(pending.reason()).isEqualTo(DenialReason.DOMAIN_NOT_OWNED);
        assertThat(foreign.reason()).isEqualTo(DenialReason.DOMAIN_NOT_OWNED);
        assertThat(missing.reason()).isEqualTo(DenialReason.MISSING_RESOURCE);
    }

    @Test
    @DisplayName("Daily limit counts delivered mail since midnight in the tenant's zone")
    void validateOperation_dailyLimit_denied() {
        // Given
        TenantFixtures.recordDelivered(store, TENANT_ID, Instant.parse("2026-03-10T01:00:00Z"), 100);

        // When
        OperationValidation validation = provider.validateOperation(TENANT_ID, OperationRequest.sendEmail(DOMAIN));

        // Then
        assertThat(validation.reason()).isEqualTo(DenialReason.DAILY_LIMIT);
        assertThat(validation.toException().getKind()).isEqualTo(ErrorKind.RATE_LIMIT_EXCEEDED);
        assertThat(validation.metadata()).containsEntry("remaining", 0L);
    }

    @Test
    @DisplayName("Mail from the previous day does not count against today")
    void validateOperation_yesterday_notCounted() {
        // Given
        TenantFixtures.recordDelivered(store, TENANT_ID, Instant.parse("2026-03-09T23:00:00Z"), 100);

        // When
        OperationValidation validation = provider.validateOperation(TENANT_ID, OperationRequest.sendEmail(DOMAIN));

        // Then
        assertThat(validation.allowed()).isTrue();
    }

    @Test
    @DisplayName("Hourly and per-minute limits use rolling windows")
    void validateOperation_rollingWindows_denied() {
        // Given
        TenantFixtures.recordDelivered(store, TENANT_ID, NOW.minus(Duration.ofMinutes(30)), 10);

        // When
        OperationValidation hourly = provider.validateOperation(TENANT_ID, OperationRequest.sendEmail(DOMAIN));

        // Then
        assertThat(hourly.reason()).isEqualTo(DenialReason.HOURLY_LIMIT);

        // Given
        InMemoryTenantStore minuteStore = TenantFixtures.store(8L, "free", TenantFixtures.signingDomain(3L, DOMAIN));
        TenantFixtures.recordDelivered(minuteStore, 8L, NOW.minusSeconds(10), 2);
        TenantContextProvider minuteProvider = TenantFixtures.provider(minuteStore, clock);

        try {
            // When
            OperationValidation minute = minuteProvider.validateOperation(8L, OperationRequest.sendEmail(DOMAIN));

            // Then
            assertThat(minute.reason()).isEqualTo(DenialReason.MINUTE_LIMIT);
            assertThat(minute.reason().isSendRateLimit()).isTrue();
        } finally {
            minuteProvider.close();
        }
    }

    @Test
    @DisplayName("Domain, webhook, API call and storage limits follow the plan")
    void validateOperation_planLimits() {
        // Given
        store.setActiveWebhooks(TENANT_ID, 2);
        store.setStorageUsedMegabytes(TENANT_ID, 90);
        store.recordApiCall(TENANT_ID, NOW.minusSeconds(30));

        // When & Then
        assertThat(provider.validateOperation(TENANT_ID, TenantOperation.ADD_DOMAIN).reason())
                .isEqualTo(DenialReason.DOMAIN_LIMIT);
        assertThat(provider.validateOperation(TENANT_ID, TenantOperation.CREATE_WEBHOOK).reason())
                .isEqualTo(DenialReason.WEBHOOK_LIMIT);
        assertThat(provider.validateOperation(TENANT_ID, TenantOperation.API_CALL).allowed()).isTrue();
        assertThat(provider.validateOperation(TENANT_ID, OperationRequest.useStorage(10)).allowed()).isTrue();
        assertThat(provider.validateOperation(TENANT_ID, OperationRequest.useStorage(11)).reason())
                .isEqualTo(DenialReason.STORAGE_LIMIT);
    }

    @Test
    @DisplayName("Usage counts delivered mail for today, this month and overall")
    void getUsage_countsDelivered() {
        // Given
        TenantFixtures.recordDelivered(store, TENANT_ID, NOW.minusSeconds(60), 3);
        TenantFixtures.recordDelivered(store, TENANT_ID, Instant.parse("2026-03-02T10:00:00Z"), 4);
        TenantFixtures.recordDelivered(store, TENANT_ID, Instant.parse("2026-02-20T10:00:00Z"), 5);

        // When
        TenantUsage usage = provider.getUsage(TENANT_ID);

        // Then
        assertThat(usage.sentToday()).isEqualTo(3);
        assertThat(usage.sentThisMonth()).isEqualTo(7);
        assertThat(usage.totalSent()).isEqualTo(12);
    }

    @Test
    @DisplayName("Recording activity stamps the tenant's last activity")
    void recordActivity_updatesStore() {
        // When
        provider.recordActivity(TENANT_ID);

        // Then
        assertThat(store.findTenant(TENANT_ID)).get()
                .extracting(TenantAccount::lastActivityAt)
                .isEqualTo(NOW);
    }
}
