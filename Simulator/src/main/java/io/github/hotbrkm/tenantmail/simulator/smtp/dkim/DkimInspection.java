package io.github.hotbrkm.tenantmail.simulator.smtp.dkim;

/**
 * Outcome of inspecting one received message. {@code domain} and {@code selector} are null when the
 * signature header is absent or unreadable.
 */
public record DkimInspection(DkimCheckResult result, String domain, String selector, String reason) {

    static DkimInspection none() {
        return new DkimInspection(DkimCheckResult.NONE, null, null, "no signature");
    }

    /**
     * Value of an {@code Authentication-Results} header for this inspection.
     */
    public String toAuthenticationResults(String authServId) {
        StringBuilder value = new StringBuilder(authServId).append("; dkim=").append(result.label());
        if (reason != null && result != DkimCheckResult.PASS) {
            value.append(" (").append(reason).append(')');
        }
        if (domain != null) {
            value.append(" header.d=").append(domain);
        }
        if (selector != null) {
            value.append(" header.s=").append(selector);
        }
        return value.toString();
    }
}
