package io.github.hotbrkm.tenantmail.agent.email.tenant.store;

import java.time.Instant;

/**
 * One row of a tenant's sending domains as the durable store keeps it, signing material included.
 */
public record DomainRecord(long domainId,
                           String domainName,
                           boolean verified,
                           boolean spfVerified,
                           boolean dkimVerified,
                           boolean dmarcVerified,
                           String dkimSelector,
                           String dkimPrivateKey,
                           String dkimPublicKey,
                           Instant verifiedAt) {

    public boolean hasKeyMaterial() {
        return (dkimPrivateKey != null && !dkimPrivateKey.isBlank())
                || (dkimPublicKey != null && !dkimPublicKey.isBlank());
    }

    @Override
    public String toString() {
        return "DomainRecord[domainId=" + domainId + ", domainName=" + domainName + ", verified=" + verified
                + ", dkimVerified=" + dkimVerified + ", dkimSelector=" + dkimSelector + "]";
    }
}
