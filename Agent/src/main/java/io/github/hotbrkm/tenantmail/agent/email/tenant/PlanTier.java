package io.github.hotbrkm.tenantmail.agent.email.tenant;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum PlanTier {
    FREE("free",
            new PlanLimits(100, 2_000, 1, 2, 100, 100),
            new RateLimits(2, 10, 100)),
    PRO("pro",
            new PlanLimits(1_000, 25_000, 5, 10, 1_000, 1_000),
            new RateLimits(10, 100, 1_000)),
    ENTERPRISE("enterprise",
            new PlanLimits(10_000, 300_000, 20, 50, 10_000, 10_000),
            new RateLimits(50, 500, 10_000));

    private final String planName;
    private final PlanLimits planLimits;
    private final RateLimits rateLimits;

    /**
     * Unknown or missing plan names fall back to {@link #FREE}.
     */
    public static PlanTier fromName(String planName) {
        if (planName == null || planName.isBlank()) {
            return FREE;
        }
        String normalized = planName.trim().toLowerCase(Locale.ROOT);
        for (PlanTier tier : values()) {
            if (tier.planName.equals(normalized)) {
                return tier;
            }
        }
        return FREE;
    }
}
