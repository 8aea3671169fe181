package io.github.hotbrkm.tenantmail.simulator.smtp.dkim;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks the {@code DKIM-Signature} header of a received message.
 * <p>
 * Required tags are {@code v a d s h bh b}; only {@code rsa-sha256} with relaxed/relaxed canonicalization is
 * accepted. The body hash is always recomputed. The signature itself is verified only when a public key is
 * known for {@code selector._domainkey.domain}, since the sink does not query DNS.
 */
@Slf4j
public class DkimSignatureInspector {

    private static final String HEADER_NAME = "dkim-signature";
    private static final String CRLF = "\r\n";
    private static final List<String> REQUIRED_TAGS = List.of("v", "a", "d", "s", "h", "bh", "b");

    private final Map<String, String> publicKeys;

    public DkimSignatureInspector(Map<String, String> publicKeys) {
        Map<String, String> normalized = new HashMap<>();
        if (publicKeys != null) {
            publicKeys.forEach((name, key) -> normalized.put(name.trim().toLowerCase(Locale.ROOT), key));
        }
        this.publicKeys = normalized;
    }

    public DkimInspection inspect(byte[] rawMessage) {
        ParsedMessage message = ParsedMessage.parse(new String(rawMessage, StandardCharsets.UTF_8));
        String signatureValue = message.header(HEADER_NAME);
        if (signatureValue == null) {
            return DkimInspection.none();
        }

        Map<String, String> tags = parseTags(signatureValue);
        String domain = tags.get("d");
        String selector = tags.get("s");
        for (String tag : REQUIRED_TAGS) {
            if (tags.get(tag) == null) {
                return new DkimInspection(DkimCheckResult.PERMERROR, domain, selector, "missing tag " + tag);
            }
        }
        if (!"rsa-sha256".equalsIgnoreCase(tags.get("a"))) {
            return new DkimInspection(DkimCheckResult.PERMERROR, domain, selector, "unsupported algorithm " + tags.get("a"));
        }

        try {
            String expectedBodyHash = bodyHash(message.body());
            if (!expectedBodyHash.equals(stripWhitespace(tags.get("bh")))) {
                return new DkimInspection(DkimCheckResult.FAIL, domain, selector, "body hash mismatch");
            }

            String publicKey = publicKeys.get((selector + "._domainkey." + domain).toLowerCase(Locale.ROOT));
            if (publicKey == null) {
                return new DkimInspection(DkimCheckResult.PASS, domain, selector, "body hash only");
            }
            boolean verified = verifySignature(message, signatureValue, tags, publicKey);
            return verified
                    ? new DkimInspection(DkimCheckResult.PASS, domain, selector, null)
                    : new DkimInspection(DkimCheckResult.FAIL, domain, selector, "signature mismatch");
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("DKIM inspection failed. domain={}, selector={}, cause={}", domain, selector, e.getMessage());
            return new DkimInspection(DkimCheckResult.PERMERROR, domain, selector, e.getClass().getSimpleName());
        }
    }

    private static boolean verifySignature(ParsedMessage message, String signatureValue, Map<String, String> tags,
                                           String publicKey) throws GeneralSecurityException {
        StringBuilder signingInput = new StringBuilder();
        for (String name : tags.get("h").split(":")) {
            String headerName = name.trim().toLowerCase(Locale.ROOT);
            String value = message.header(headerName);
            if (value != null) {
                signingInput.append(canonicalizeHeader(headerName, value)).append(CRLF);
            }
        }
        signingInput.append(canonicalizeHeader(HEADER_NAME, withEmptySignature(signatureValue)));

        PublicKey key = KeyFactory.getInstance("RSA")
                .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(stripWhitespace(publicKey))));
        Signature verifier = Signature.getInstance("SHA256withRSA");
        verifier.initVerify(key);
        verifier.update(signingInput.toString().getBytes(StandardCharsets.UTF_8));
        return verifier.verify(Base64.getDecoder().decode(stripWhitespace(tags.get("b"))));
    }

    static String bodyHash(String body) throws GeneralSecurityException {
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return Base64.getEncoder().encodeToString(digest.digest(canonicalizeBody(body).getBytes(StandardCharsets.UTF_8)));
    }

    static String canonicalizeBody(String body) {
        if (body == null || body.isEmpty()) {
            return CRLF;
        }
        List<String> lines = new ArrayList<>();
        boolean previousBlank = false;
        for (String line : body.split("\r\n|\n|\r", -1)) {
            String stripped = line.replaceAll("[ \t]+$", "");
            boolean blank = stripped.isEmpty();
            if (!(blank && previousBlank)) {
                lines.add(stripped);
            }
            previousBlank = blank;
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines.isEmpty() ? CRLF : String.join(CRLF, lines) + CRLF;
    }

    static String canonicalizeHeader(String name, String value) {
        String unfolded = value.replace("\r", "").replace("\n", "");
        return name.trim().toLowerCase(Locale.ROOT) + ":"
                + unfolded.replaceAll("[ \t]+", " ").trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Empties the value of the {@code b} tag and keeps every other byte of the header value as received.
     */
    static String withEmptySignature(String signatureValue) {
        String[] parts = signatureValue.split(";", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            int equals = part.indexOf('=');
            if (equals > 0 && part.substring(0, equals).trim().equalsIgnoreCase("b")) {
                parts[i] = part.substring(0, equals + 1);
            }
        }
        return String.join(";", parts);
    }

    static Map<String, String> parseTags(String value) {
        Map<String, String> tags = new HashMap<>();
        for (String part : value.split(";")) {
            String token = part.trim();
            int index = token.indexOf('=');
            if (index <= 0) {
                continue;
            }
            String key = token.substring(0, index).trim().toLowerCase(Locale.ROOT);
            String tagValue = token.substring(index + 1).trim();
            if (!tagValue.isEmpty()) {
                tags.put(key, tagValue);
            }
        }
        return tags;
    }

    private static String stripWhitespace(String value) {
        return value.replaceAll("\\s+", "");
    }

    private record ParsedMessage(List<String[]> headers, String body) {

        static ParsedMessage parse(String raw) {
            int separator = raw.indexOf("\r\n\r\n");
            int bodyStart = separator + 4;
            if (separator < 0) {
                separator = raw.indexOf("\n\n");
                bodyStart = separator + 2;
            }
            String headerBlock = separator < 0 ? raw : raw.substring(0, separator);
            String body = separator < 0 ? "" : raw.substring(bodyStart);

            List<String[]> headers = new ArrayList<>();
            String[] current = null;
            for (String line : headerBlock.split("\r\n|\n", -1)) {
                if (!line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t') && current != null) {
                    current[1] = current[1] + CRLF + line;
                    continue;
                }
                int colon = line.indexOf(':');
                if (colon <= 0) {
                    continue;
                }
                current = new String[]{line.substring(0, colon).trim(), line.substring(colon + 1)};
                headers.add(current);
            }
            return new ParsedMessage(headers, body);
        }

        String header(String name) {
            for (String[] header : headers) {
                if (header[0].equalsIgnoreCase(name)) {
                    return header[1];
                }
            }
            return null;
        }
    }
}
