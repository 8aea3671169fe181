package io.github.hotbrkm.tenantmail.agent.email.mime;

import java.util.List;
import java.util.Map;

/**
 * Unsigned message content. At least one of {@code html} and {@code text} is expected.
 */
public record MailContent(String from, List<String> to, String subject, String html, String text,
                          Map<String, String> headers) {

    public MailContent {
        to = to == null ? List.of() : List.copyOf(to);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public MailContent(String from, List<String> to, String subject, String html, String text) {
        this(from, to, subject, html, text, Map.of());
    }
}
