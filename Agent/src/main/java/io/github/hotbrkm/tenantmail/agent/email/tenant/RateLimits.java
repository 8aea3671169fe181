package io.github.hotbrkm.tenantmail.agent.email.tenant;

/**
 * Send ceilings per rolling minute, rolling hour and calendar day.
 */
public record RateLimits(int perMinute, int perHour, int perDay) {
}
