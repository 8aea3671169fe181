package io.github.hotbrkm.tenantmail.agent.email.mime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header and body view of a serialized RFC 5322 message. Folded headers are unfolded;
 * when a header repeats, the first occurrence wins.
 */
record RawMessage(Map<String, String> headers, String body) {

    static RawMessage parse(String content) {
        String text = content == null ? "" : content;
        int separator = text.indexOf("\r\n\r\n");
        int separatorLength = 4;
        if (separator < 0) {
            separator = text.indexOf("\n\n");
            separatorLength = 2;
        }

        String headerBlock = separator < 0 ? text : text.substring(0, separator);
        String body = separator < 0 ? "" : text.substring(separator + separatorLength);

        Map<String, String> headers = new LinkedHashMap<>();
        for (String field : unfold(headerBlock)) {
            int colon = field.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String name = field.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            headers.putIfAbsent(name, field.substring(colon + 1));
        }
        return new RawMessage(Collections.unmodifiableMap(headers), body);
    }

    String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    private static List<String> unfold(String headerBlock) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = null;
        for (String line : headerBlock.split("\r\n|\n", -1)) {
            if (line.isEmpty()) {
                continue;
            }
            boolean continuation = line.charAt(0) == ' ' || line.charAt(0) == '\t';
            if (continuation && current != null) {
                current.append(line);
            } else {
                if (current != null) {
                    fields.add(current.toString());
                }
                current = new StringBuilder(line);
            }
        }
        if (current != null) {
            fields.add(current.toString());
        }
        return fields;
    }
}
