package io.github.hotbrkm.tenantmail.agent.email.tenant;

public record PlanLimits(int emailsPerDay, int emailsPerMonth, int domains, int webhooks, int apiCallsPerHour,
                         int storageMegabytes) {
}
