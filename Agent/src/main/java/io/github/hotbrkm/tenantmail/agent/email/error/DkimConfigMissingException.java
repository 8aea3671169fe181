package io.github.hotbrkm.tenantmail.agent.email.error;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a verified sender domain has no signing configuration. Lists the domains that can sign
 * and the verified domains that cannot, so the operator can see which alternative to use.
 */
@Getter
public class DkimConfigMissingException extends TenantMailException {

    private final String requestedDomain;
    private final List<String> configuredDomains;
    private final List<String> unconfiguredVerifiedDomains;

    public DkimConfigMissingException(String requestedDomain, List<String> configuredDomains,
                                      List<String> unconfiguredVerifiedDomains) {
        super(ErrorKind.DKIM_CONFIG_MISSING, buildMessage(requestedDomain, configuredDomains, unconfiguredVerifiedDomains));
        this.requestedDomain = requestedDomain;
        this.configuredDomains = List.copyOf(configuredDomains);
        this.unconfiguredVerifiedDomains = List.copyOf(unconfiguredVerifiedDomains);
    }

    private static String buildMessage(String requestedDomain, List<String> configuredDomains,
                                       List<String> unconfiguredVerifiedDomains) {
        StringBuilder message = new StringBuilder("No DKIM configuration for domain ").append(requestedDomain).append('.');
        if (configuredDomains.isEmpty()) {
            message.append(" No domain of this tenant has a DKIM configuration.");
        } else {
            message.append(" Domains with DKIM configuration: ").append(String.join(", ", configuredDomains)).append('.');
        }
        if (!unconfiguredVerifiedDomains.isEmpty()) {
            message.append(" Verified domains without DKIM configuration: ")
                    .append(String.join(", ", unconfiguredVerifiedDomains)).append('.');
        }
        return message.toString();
    }
}
