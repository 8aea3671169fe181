package io.github.hotbrkm.tenantmail.agent.email.mime;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Relaxed canonicalization used by {@link DkimSigner}.
 * <p>
 * Header: unfold, collapse whitespace runs to one space, trim, lower-case, {@code name:value}.
 * Body: strip trailing whitespace per line, collapse runs of empty lines, end with exactly one CRLF.
 * Both are idempotent.
 */
public final class DkimCanonicalizer {

    static final String CRLF = "\r\n";

    private DkimCanonicalizer() {
    }

    public static String canonicalizeHeader(String name, String value) {
        String canonicalName = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return canonicalName + ":" + canonicalizeHeaderValue(value);
    }

    public static String canonicalizeHeaderValue(String value) {
        if (value == null) {
            return "";
        }
        String unfolded = value.replace("\r", "").replace("\n", "");
        return collapseWhitespace(unfolded).trim().toLowerCase(Locale.ROOT);
    }

    public static String canonicalizeBody(String body) {
        if (body == null || body.isEmpty()) {
            return CRLF;
        }

        String[] lines = body.split("\r\n|\n|\r", -1);
        List<String> canonical = new ArrayList<>(lines.length);
        boolean previousBlank = false;
        for (String line : lines) {
            String stripped = stripTrailingWhitespace(line);
            boolean blank = stripped.isEmpty();
            if (blank && previousBlank) {
                continue;
            }
            canonical.add(stripped);
            previousBlank = blank;
        }

        while (!canonical.isEmpty() && canonical.get(canonical.size() - 1).isEmpty()) {
            canonical.remove(canonical.size() - 1);
        }
        if (canonical.isEmpty()) {
            return CRLF;
        }
        return String.join(CRLF, canonical) + CRLF;
    }

    private static String collapseWhitespace(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean inWhitespace = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ' ' || c == '\t') {
                if (!inWhitespace) {
                    builder.append(' ');
                    inWhitespace = true;
                }
            } else {
                builder.append(c);
                inWhitespace = false;
            }
        }
        return builder.toString();
    }

    private static String stripTrailingWhitespace(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == '\t')) {
            end--;
        }
        return line.substring(0, end);
    }
}
