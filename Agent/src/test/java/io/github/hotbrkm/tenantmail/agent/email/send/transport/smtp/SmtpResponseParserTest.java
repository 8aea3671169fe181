package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SmtpResponseParser Test")
class SmtpResponseParserTest {

    @Test
    @DisplayName("Single-line reply keeps code and text")
    void parse_singleLine() {
        // When
        SmtpResponse response = SmtpResponseParser.parseResponse(List.of("250 2.0.0 Ok: queued"));

        // Then
        assertThat(response.statusCode()).isEqualTo(250);
        assertThat(response.message()).isEqualTo("2.0.0 Ok: queued");
        assertThat(response.originalMessage()).isEqualTo("250 2.0.0 Ok: queued");
        assertThat(response.extendedMessages()).isEmpty();
    }

    @Test
    @DisplayName("Multi-line EHLO reply collects continuation lines")
    void parse_multiLine() {
        // When
        SmtpResponse response = SmtpResponseParser.parseResponse(List.of(
                "250-smtp.simulator", "250-SIZE 26214400", "250-STARTTLS", "250 8BITMIME"));

        // Then
        assertThat(response.statusCode()).isEqualTo(250);
        assertThat(response.message()).isEqualTo("8BITMIME");
        assertThat(response.extendedMessages()).containsExactly("smtp.simulator", "SIZE 26214400", "STARTTLS");
        assertThat(response.contains("starttls")).isTrue();
        assertThat(response.contains("SIZE")).isTrue();
        assertThat(response.contains("8BITMIME")).isTrue();
        assertThat(response.contains("AUTH")).isFalse();
    }

    @Test
    @DisplayName("Keyword match requires a whole word")
    void contains_wholeWordOnly() {
        // When
        SmtpResponse response = SmtpResponseParser.parseResponse(List.of("250-STARTTLSX", "250 OK"));

        // Then
        assertThat(response.contains("STARTTLS")).isFalse();
    }

    @Test
    @DisplayName("Bare three-digit code is accepted")
    void parse_codeOnly() {
        // When
        SmtpResponse response = SmtpResponseParser.parseResponse(List.of("354"));

        // Then
        assertThat(response.statusCode()).isEqualTo(354);
        assertThat(response.message()).isEmpty();
    }

    @Test
    @DisplayName("Garbage before the final line marks the reply invalid")
    void parse_invalid() {
        // When
        SmtpResponse response = SmtpResponseParser.parseResponse(List.of("hello there"));

        // Then
        assertThat(response.statusCode()).isEqualTo(SmtpStatus.SESSION_INVALID);
        assertThat(response.message()).contains("hello there");
    }

    @Test
    @DisplayName("Garbage after the final line is ignored")
    void parse_trailingGarbageIgnored() {
        // When
        SmtpResponse response = SmtpResponseParser.parseResponse(List.of("550 5.1.1 Mailbox unavailable", "xx"));

        // Then
        assertThat(response.statusCode()).isEqualTo(550);
        assertThat(response.message()).isEqualTo("5.1.1 Mailbox unavailable");
    }
}
