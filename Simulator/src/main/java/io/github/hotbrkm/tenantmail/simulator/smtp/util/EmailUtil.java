package io.github.hotbrkm.tenantmail.simulator.smtp.util;

import java.util.Locale;

/**
 * Utility class for email address operations.
 */
public final class EmailUtil {

    private EmailUtil() {
        // Prevent instantiation
    }

    /**
     * Extracts the domain part from an email address.
     *
     * @param address Email address (e.g. user@example.com), optionally in angle brackets
     * @return Domain part (lowercase), or null if invalid
     */
    public static String extractDomain(String address) {
        String normalized = normalizeAddress(address);
        if (normalized == null) {
            return null;
        }
        int at = normalized.lastIndexOf('@');
        if (at <= 0 || at == normalized.length() - 1) {
            return null;
        }
        return normalized.substring(at + 1);
    }

    /**
     * Strips angle brackets and surrounding whitespace and lower-cases the address.
     */
    public static String normalizeAddress(String address) {
        if (address == null) {
            return null;
        }
        String trimmed = address.trim();
        if (trimmed.startsWith("<") && trimmed.endsWith(">")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }
}
