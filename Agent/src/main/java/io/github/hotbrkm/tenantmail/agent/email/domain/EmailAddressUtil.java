package io.github.hotbrkm.tenantmail.agent.email.domain;

import java.net.IDN;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public final class EmailAddressUtil {
    /**
     * Label used when email/domain is determined to be invalid
     */
    public static final String INVALID = "INVALID";

    private static final Set<Character> FORBIDDEN_DOMAIN_CHARS = Set.of(',', '"', '\'', '<', '>', '\\', '/', ' ', ':');

    private EmailAddressUtil() {}

    /**
     * Strips a display name, angle brackets and surrounding quotes, leaving the bare addr-spec.
     */
    public static String extractAddress(String email) {
        if (email == null) {
            return "";
        }
        String addr = email.trim();
        int lt = addr.indexOf('<');
        int gt = addr.indexOf('>');
        if (lt >= 0 && gt > lt) {
            addr = addr.substring(lt + 1, gt).trim();
        }
        if (addr.startsWith("\"") && addr.endsWith("\"") && addr.length() >= 2) {
            addr = addr.substring(1, addr.length() - 1).trim();
        }
        return addr;
    }

    public static String extractDomain(String email) {
        String addr = extractAddress(email);
        if (addr.isEmpty()) {
            return INVALID;
        }

        int at = addr.lastIndexOf('@');
        if (at <= 0 || at >= addr.length() - 1) {
            return INVALID;
        }
        String dom = addr.substring(at + 1).trim();
        if (dom.isEmpty() || dom.charAt(0) == '[') {
            return INVALID;
        }
        if (dom.endsWith(".")) {
            dom = dom.substring(0, dom.length() - 1);
        }

        String asciiDom;
        try {
            asciiDom = IDN.toASCII(dom);
        } catch (IllegalArgumentException e) {
            return INVALID;
        }

        for (int i = 0; i < asciiDom.length(); i++) {
            if (FORBIDDEN_DOMAIN_CHARS.contains(asciiDom.charAt(i))) {
                return INVALID;
            }
        }
        if (asciiDom.length() <= 2) {
            return INVALID;
        }

        return asciiDom.toLowerCase();
    }

    public static boolean isValid(String email) {
        return !INVALID.equals(extractDomain(email));
    }

    /**
     * Groups bare recipient addresses by domain, keeping first-seen order. Invalid addresses land under {@link #INVALID}.
     */
    public static Map<String, List<String>> groupByDomain(Collection<String> recipients) {
        return recipients.stream()
                .map(EmailAddressUtil::extractAddress)
                .collect(Collectors.groupingBy(EmailAddressUtil::extractDomain, LinkedHashMap::new, Collectors.toList()));
    }
}
