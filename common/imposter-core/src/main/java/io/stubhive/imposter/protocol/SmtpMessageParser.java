package io.stubhive.imposter.protocol;

import io.stubhive.imposter.model.SmtpAddress;
import io.stubhive.imposter.model.SmtpImposterRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the headers and plain text body of a message received after
 * {@code DATA}. Folded header lines are unfolded; the first occurrence of a
 * header wins.
 */
public final class SmtpMessageParser {

    private SmtpMessageParser() {
    }

    public static SmtpImposterRequest parse(String requestFrom, String ip, String envelopeFrom,
                                            List<String> envelopeTo, List<String> lines) {
        Map<String, String> headers = new LinkedHashMap<>();
        int index = 0;
        String name = null;
        StringBuilder value = new StringBuilder();
        for (; index < lines.size(); index++) {
            String line = lines.get(index);
            if (line.isEmpty()) {
                index++;
                break;
            }
            if ((line.startsWith(" ") || line.startsWith("\t")) && name != null) {
                value.append(' ').append(line.trim());
                continue;
            }
            if (name != null) {
                headers.putIfAbsent(name, value.toString());
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                // no header block, the whole message is body
                name = null;
                headers.clear();
                index = 0;
                break;
            }
            name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            value.setLength(0);
            value.append(line.substring(colon + 1).trim());
        }
        if (name != null) {
            headers.putIfAbsent(name, value.toString());
        }
        String text = String.join("\n", lines.subList(Math.min(index, lines.size()), lines.size()));

        String from = headers.get("from");
        return new SmtpImposterRequest(
            requestFrom,
            ip,
            Instant.now(),
            envelopeFrom,
            envelopeTo,
            from == null ? null : SmtpAddress.parse(from),
            addresses(headers.get("to")),
            addresses(headers.get("cc")),
            headers.getOrDefault("subject", ""),
            text);
    }

    static List<SmtpAddress> addresses(String header) {
        List<SmtpAddress> result = new ArrayList<>();
        if (header == null || header.isBlank()) {
            return result;
        }
        boolean quoted = false;
        int depth = 0;
        int start = 0;
        for (int i = 0; i < header.length(); i++) {
            char c = header.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '<' && !quoted) {
                depth++;
            } else if (c == '>' && !quoted && depth > 0) {
                depth--;
            } else if (c == ',' && !quoted && depth == 0) {
                addAddress(result, header.substring(start, i));
                start = i + 1;
            }
        }
        addAddress(result, header.substring(start));
        return result;
    }

    private static void addAddress(List<SmtpAddress> result, String raw) {
        if (!raw.isBlank()) {
            result.add(SmtpAddress.parse(raw));
        }
    }
}
