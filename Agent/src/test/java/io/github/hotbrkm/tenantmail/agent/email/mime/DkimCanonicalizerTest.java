package io.github.hotbrkm.tenantmail.agent.email.mime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DkimCanonicalizer Test")
class DkimCanonicalizerTest {

    @Test
    @DisplayName("Header is unfolded, whitespace collapsed, trimmed and lower-cased")
    void canonicalizeHeader_relaxed() {
        // When
        String canonical = DkimCanonicalizer.canonicalizeHeader(" Subject ", "  Hello\r\n \t World  ");

        // Then
        assertThat(canonical).isEqualTo("subject:hello world");
    }

    @Test
    @DisplayName("Null header value becomes empty")
    void canonicalizeHeader_nullValue() {
        // When & Then
        assertThat(DkimCanonicalizer.canonicalizeHeader("To", null)).isEqualTo("to:");
    }

    @Test
    @DisplayName("Body loses trailing whitespace and blank-line runs and ends with one CRLF")
    void canonicalizeBody_relaxed() {
        // When
        String canonical = DkimCanonicalizer.canonicalizeBody("line one  \n\n\n\nline two\t\r\n\r\n\r\n");

        // Then
        assertThat(canonical).isEqualTo("line one\r\n\r\nline two\r\n");
    }

    @Test
    @DisplayName("Empty body canonicalizes to a single CRLF")
    void canonicalizeBody_empty() {
        // When & Then
        assertThat(DkimCanonicalizer.canonicalizeBody("")).isEqualTo("\r\n");
        assertThat(DkimCanonicalizer.canonicalizeBody(null)).isEqualTo("\r\n");
        assertThat(DkimCanonicalizer.canonicalizeBody("\r\n\r\n")).isEqualTo("\r\n");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Hello   World", "  MIXED case\tvalue ", "already canonical", "a\r\n b"})
    @DisplayName("Header canonicalization is idempotent")
    void canonicalizeHeaderValue_idempotent(String value) {
        // When
        String once = DkimCanonicalizer.canonicalizeHeaderValue(value);

        // Then
        assertThat(DkimCanonicalizer.canonicalizeHeaderValue(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"body\r\n", "a  \n\n\nb", "\n\n", "x\ty \r\n\r\nz\r\n\r\n", "no newline"})
    @DisplayName("Body canonicalization is idempotent")
    void canonicalizeBody_idempotent(String body) {
        // When
        String once = DkimCanonicalizer.canonicalizeBody(body);

        // Then
        assertThat(DkimCanonicalizer.canonicalizeBody(once)).isEqualTo(once);
    }
}
