package io.github.hotbrkm.tenantmail.agent.email.send.transport.smtp;

import java.util.ArrayList;
import java.util.List;

final class SmtpResponseParser {

    static final int INVALID_RESPONSE = SmtpStatus.SESSION_INVALID;

    private SmtpResponseParser() {
    }

    /**
     * Parses reply lines. A malformed line before any final line marks the whole reply invalid (888);
     * malformed lines after a final line are ignored.
     */
    static SmtpResponse parseResponse(List<String> lines) {
        List<String> extended = new ArrayList<>();
        int statusCode = 0;
        String message = null;
        String originalMessage = null;

        for (String line : lines) {
            Integer code = parseCode(line);
            if (code == null) {
                if (statusCode <= 0) {
                    statusCode = INVALID_RESPONSE;
                    message = "response message is invalid. [" + line + "]";
                    originalMessage = INVALID_RESPONSE + " " + message;
                }
                continue;
            }

            String text = line.length() > 4 ? line.substring(4).trim() : "";
            if (line.length() > 3 && line.charAt(3) == '-') {
                extended.add(text);
            } else {
                statusCode = code;
                message = text;
                originalMessage = line;
            }
        }

        return new SmtpResponse(statusCode, message, originalMessage, extended);
    }

    private static Integer parseCode(String line) {
        if (line == null || line.length() < 3) {
            return null;
        }
        if (line.length() > 3 && line.charAt(3) != ' ' && line.charAt(3) != '-') {
            return null;
        }
        for (int i = 0; i < 3; i++) {
            if (!Character.isDigit(line.charAt(i))) {
                return null;
            }
        }
        return Integer.parseInt(line.substring(0, 3));
    }
}
