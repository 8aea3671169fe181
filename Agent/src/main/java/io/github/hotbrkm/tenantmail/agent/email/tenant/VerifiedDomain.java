package io.github.hotbrkm.tenantmail.agent.email.tenant;

import java.time.Instant;

public record VerifiedDomain(String domainName, boolean verified, boolean spfVerified, boolean dkimVerified,
                             boolean dmarcVerified, String selector, Instant lastVerifiedAt) {
}
