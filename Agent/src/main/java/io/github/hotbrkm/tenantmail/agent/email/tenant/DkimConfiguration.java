package io.github.hotbrkm.tenantmail.agent.email.tenant;

/**
 * Signing material of one domain. Only a complete configuration (selector, private key and public key
 * all present) may be used for signing.
 */
public record DkimConfiguration(long domainId, String domainName, String selector, String privateKey,
                                String publicKey, boolean active) {

    public boolean isComplete() {
        return hasText(domainName) && hasText(selector) && hasText(privateKey) && hasText(publicKey);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "DkimConfiguration[domainId=" + domainId + ", domainName=" + domainName + ", selector=" + selector
                + ", active=" + active + "]";
    }
}
