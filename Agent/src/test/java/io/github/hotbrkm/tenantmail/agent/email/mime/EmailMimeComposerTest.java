package io.github.hotbrkm.tenantmail.agent.email.mime;

import io.github.hotbrkm.tenantmail.agent.email.tenant.DkimConfiguration;
import io.github.hotbrkm.tenantmail.agent.email.tenant.TenantFixtures;
import io.github.hotbrkm.tenantmail.simulator.smtp.dkim.DkimCheckResult;
import io.github.hotbrkm.tenantmail.simulator.smtp.dkim.DkimInspection;
import io.github.hotbrkm.tenantmail.simulator.smtp.dkim.DkimSignatureInspector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static io.github.hotbrkm.tenantmail.agent.email.tenant.TenantFixtures.DOMAIN;
import static io.github.hotbrkm.tenantmail.agent.email.tenant.TenantFixtures.NOW;
import static io.github.hotbrkm.tenantmail.agent.email.tenant.TenantFixtures.SELECTOR;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmailMimeComposer Test")
class EmailMimeComposerTest {

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final EmailMimeComposer composer = new EmailMimeComposer(new DkimSigner(clock), clock);
    private final DkimConfiguration dkim = new DkimConfiguration(1L, DOMAIN, SELECTOR,
            TenantFixtures.privateKeyPem(), TenantFixtures.publicKeyBase64(), true);
    private final DkimSignatureInspector inspector =
            new DkimSignatureInspector(Map.of(SELECTOR + "._domainkey." + DOMAIN, TenantFixtures.publicKeyBase64()));

    @Test
    @DisplayName("Composed message starts with the signature header and carries envelope data")
    void compose_signedMessage() {
        // Given
        MailContent content = new MailContent("Acme <sender@acme.test>", List.of("User <user@dest.test>", "ops@dest.test"),
                "Order shipped", "<p>Hi</p>", "Hi");

        // When
        SignedMessage message = composer.compose(content, dkim);

        // Then
        assertThat(message.content()).startsWith("DKIM-Signature: v=1; a=rsa-sha256; c=relaxed/relaxed; d=acme.test; s=mail;");
        assertThat(message.envelopeFrom()).isEqualTo("sender@acme.test");
        assertThat(message.recipients()).containsExactly("user@dest.test", "ops@dest.test");
        assertThat(message.messageId()).startsWith("<").endsWith("@acme.test>");
        assertThat(message.content()).contains("Message-ID: " + message.messageId());
        assertThat(message.signingDomain()).isEqualTo(DOMAIN);
        assertThat(message.selector()).isEqualTo(SELECTOR);
    }

    @Test
    @DisplayName("An independent verifier accepts the signature")
    void compose_verifiesIndependently() {
        // Given
        MailContent content = new MailContent("sender@acme.test", List.of("user@dest.test"),
                "Welcome aboard", "<html><body><h1>Welcome</h1></body></html>", "Welcome");

        // When
        SignedMessage message = composer.compose(content, dkim);
        DkimInspection inspection = inspector.inspect(message.content().getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(inspection.result()).isEqualTo(DkimCheckResult.PASS);
        assertThat(inspection.domain()).isEqualTo(DOMAIN);
        assertThat(inspection.selector()).isEqualTo(SELECTOR);
    }

    @Test
    @DisplayName("Text-only message with custom headers still verifies")
    void compose_textOnlyWithHeaders() {
        // Given
        MailContent content = new MailContent("sender@acme.test", List.of("user@dest.test"), "Plain",
                null, "just text", Map.of("X-Campaign", "spring"));

        // When
        SignedMessage message = composer.compose(content, dkim);

        // Then
        assertThat(message.content()).contains("X-Campaign: spring");
        assertThat(inspector.inspect(message.content().getBytes(StandardCharsets.UTF_8)).result())
                .isEqualTo(DkimCheckResult.PASS);
    }

    @Test
    @DisplayName("Date header follows the requested zone")
    void compose_dateInTenantZone() {
        // Given
        MailContent content = new MailContent("sender@acme.test", List.of("user@dest.test"), "Zone", null, "x");

        // When
        SignedMessage message = composer.compose(content, dkim, ZoneId.of("America/Sao_Paulo"));

        // Then
        assertThat(message.content()).contains("12:00:00 -0300");
    }

    @Test
    @DisplayName("Tampering with the body after signing is detected")
    void compose_tamperDetected() {
        // Given
        SignedMessage message = composer.compose(
                new MailContent("sender@acme.test", List.of("user@dest.test"), "Tamper", null, "original"), dkim);
        String tampered = message.content() + "appended\r\n";

        // When
        DkimInspection inspection = inspector.inspect(tampered.getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(inspection.result()).isEqualTo(DkimCheckResult.FAIL);
    }
}
