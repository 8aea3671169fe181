package io.github.hotbrkm.tenantmail.agent.email.tenant;

public record TenantUsage(long tenantId, long sentToday, long sentThisMonth, long totalSent) {
}
