package io.github.hotbrkm.tenantmail.agent.email.mime;

import io.github.hotbrkm.tenantmail.agent.email.error.ErrorKind;
import io.github.hotbrkm.tenantmail.agent.email.error.TenantMailException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.Signature;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * RSA-SHA256 signer with relaxed/relaxed canonicalization over a fixed header subset.
 * <p>
 * The timestamp comes from the injected {@link Clock}; with a fixed clock the output is byte-stable.
 */
@Slf4j
public class DkimSigner {

    public static final String HEADER_NAME = "DKIM-Signature";
    static final List<String> SIGNED_HEADERS = List.of("from", "to", "subject", "date", "message-id");

    private static final String SIGNATURE_TEMPLATE = "v=1; a=rsa-sha256; c=relaxed/relaxed; d=%s; s=%s; t=%d; bh=%s; h=%s; b=";

    private final Clock clock;

    public DkimSigner(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Signs a serialized message and returns the complete {@code DKIM-Signature} header field.
     *
     * @throws TenantMailException {@code INVALID_KEY_MATERIAL} if the key cannot be parsed,
     *                             {@code SIGNING_FAILED} for any cryptographic failure
     */
    public String sign(String message, String domain, String selector, String privateKey) {
        PrivateKey key = DkimPrivateKeyParser.parse(privateKey);
        return sign(message, domain, selector, key);
    }

    public String sign(String message, String domain, String selector, PrivateKey privateKey) {
        if (domain == null || domain.isBlank() || selector == null || selector.isBlank()) {
            throw new TenantMailException(ErrorKind.SIGNING_FAILED, "Signing domain and selector are required");
        }

        try {
            RawMessage rawMessage = RawMessage.parse(message);
            String bodyHash = bodyHash(rawMessage.body());

            List<String> signedNames = new ArrayList<>();
            StringBuilder signingInput = new StringBuilder();
            for (String name : SIGNED_HEADERS) {
                String value = rawMessage.header(name);
                if (value == null) {
                    continue;
                }
                signedNames.add(name);
                signingInput.append(DkimCanonicalizer.canonicalizeHeader(name, value)).append(DkimCanonicalizer.CRLF);
            }

            long timestamp = clock.instant().getEpochSecond();
            String unsignedTag = String.format(SIGNATURE_TEMPLATE, domain, selector, timestamp, bodyHash,
                    String.join(":", signedNames));
            signingInput.append(DkimCanonicalizer.canonicalizeHeader(HEADER_NAME, unsignedTag));

            Signature signature = Signature.getInstance("SHA256withRSA");
            signature.initSign(privateKey);
            signature.update(signingInput.toString().getBytes(StandardCharsets.UTF_8));
            String b = Base64.getEncoder().encodeToString(signature.sign());

            return HEADER_NAME + ": " + unsignedTag + b;
        } catch (GeneralSecurityException e) {
            log.error("DKIM signing failed. domain={}, selector={}", domain, selector, e);
            throw new TenantMailException(ErrorKind.SIGNING_FAILED, "DKIM signing failed: " + e.getMessage(), e);
        }
    }

    static String bodyHash(String body) throws GeneralSecurityException {
        String canonicalBody = DkimCanonicalizer.canonicalizeBody(body);
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return Base64.getEncoder().encodeToString(digest.digest(canonicalBody.getBytes(StandardCharsets.UTF_8)));
    }
}
