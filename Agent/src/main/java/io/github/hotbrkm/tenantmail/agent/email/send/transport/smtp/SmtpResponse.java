package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import java.util.List;
import java.util.Locale;

/**
 * Parsed server reply. {@code extendedMessages} holds the continuation lines of a multi-line reply
 * ({@code 250-...}); {@code message} is the text of the final line.
 */
record SmtpResponse(int statusCode, String message, String originalMessage, List<String> extendedMessages) {

    SmtpResponse {
        extendedMessages = extendedMessages == null ? List.of() : List.copyOf(extendedMessages);
    }

    /**
     * True when any reply line announces the given keyword, e.g. {@code STARTTLS} or {@code SIZE 35882577}.
     */
    boolean contains(String keyword) {
        String expected = keyword.toUpperCase(Locale.ROOT);
        return extendedMessages.stream().anyMatch(it -> announces(it, expected))
                || (message != null && announces(message, expected));
    }

    private static boolean announces(String line, String keyword) {
        String upper = line.toUpperCase(Locale.ROOT);
        return upper.equals(keyword) || upper.startsWith(keyword + " ");
    }

    @Override
    public String toString() {
        StringBuilder responseBuilder = new StringBuilder();

        for (String extMessage : extendedMessages) {
            responseBuilder.append(statusCode).append("-").append(extMessage).append("\n");
        }

        responseBuilder.append(statusCode).append(" ").append(message);
        return responseBuilder.toString();
    }
}
