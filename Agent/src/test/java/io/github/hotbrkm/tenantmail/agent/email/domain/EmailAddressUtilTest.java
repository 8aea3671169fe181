package io.github.hotbrkm.tenantmail.agent.email.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmailAddressUtil Test")
class EmailAddressUtilTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "user@acme.test|user@acme.test",
            "  Acme Support <support@acme.test>  |support@acme.test",
            "\"quoted@acme.test\"|quoted@acme.test",
            "<bare@acme.test>|bare@acme.test"
    })
    @DisplayName("Display names, brackets and quotes are stripped")
    void extractAddress(String input, String expected) {
        // When & Then
        assertThat(EmailAddressUtil.extractAddress(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Null address extracts to empty string")
    void extractAddress_null() {
        // When & Then
        assertThat(EmailAddressUtil.extractAddress(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "user@Acme.Test|acme.test",
            "User <user@dest.test.>|dest.test",
            "a@b@mail.dest.test|mail.dest.test"
    })
    @DisplayName("Domain is lower-cased and loses a trailing dot")
    void extractDomain(String input, String expected) {
        // When & Then
        assertThat(EmailAddressUtil.extractDomain(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Internationalized domains are converted to ASCII")
    void extractDomain_idn() {
        // When & Then
        assertThat(EmailAddressUtil.extractDomain("user@bücher.test")).isEqualTo("xn--bcher-kva.test");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "no-at-sign", "@acme.test", "user@", "user@[10.0.0.1]", "user@ab", "user@ac me.test"})
    @DisplayName("Malformed addresses are marked INVALID")
    void extractDomain_invalid(String input) {
        // When & Then
        assertThat(EmailAddressUtil.extractDomain(input)).isEqualTo(EmailAddressUtil.INVALID);
        assertThat(EmailAddressUtil.isValid(input)).isFalse();
    }

    @Test
    @DisplayName("Recipients are grouped by domain in first-seen order")
    void groupByDomain() {
        // Given
        List<String> recipients = List.of("a@dest.test", "Bob <b@other.test>", "c@DEST.test", "broken");

        // When
        Map<String, List<String>> grouped = EmailAddressUtil.groupByDomain(recipients);

        // Then
        assertThat(grouped).containsOnlyKeys("dest.test", "other.test", EmailAddressUtil.INVALID);
        assertThat(grouped.keySet()).containsExactly("dest.test", "other.test", EmailAddressUtil.INVALID);
        assertThat(grouped.get("dest.test")).containsExactly("a@dest.test", "c@DEST.test");
        assertThat(grouped.get("other.test")).containsExactly("b@other.test");
        assertThat(grouped.get(EmailAddressUtil.INVALID)).containsExactly("broken");
    }
}
