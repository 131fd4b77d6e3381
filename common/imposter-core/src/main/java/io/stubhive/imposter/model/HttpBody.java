package io.stubhive.imposter.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.InvalidImposterException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * HTTP body representation in response payloads. A body is text unless the
 * payload carries {@code "_mode": "binary"}, in which case it is base64.
 */
public final class HttpBody {

    public static final String MODE_FIELD = "_mode";
    public static final String BINARY = "binary";

    private HttpBody() {
    }

    /**
     * Stores {@code bytes} as the payload body, switching to base64 when the
     * content type is not textual or the bytes are not valid UTF-8.
     */
    public static void put(ObjectNode payload, byte[] bytes, String contentType) {
        String text = isTextual(contentType) ? utf8OrNull(bytes) : null;
        if (text != null) {
            payload.put("body", text);
        } else {
            payload.put("body", Base64.getEncoder().encodeToString(bytes));
            payload.put(MODE_FIELD, BINARY);
        }
    }

    /**
     * Bytes to put on the wire for the payload body.
     */
    public static byte[] bytes(ObjectNode payload) {
        JsonNode body = payload.get("body");
        if (BINARY.equals(payload.path(MODE_FIELD).asText())) {
            try {
                return Base64.getDecoder().decode(body == null ? "" : body.asText());
            } catch (IllegalArgumentException ex) {
                throw new InvalidImposterException("binary body must be base64 encoded", ex);
            }
        }
        return text(body).getBytes(StandardCharsets.UTF_8);
    }

    public static String text(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return "";
        }
        return body.isTextual() ? body.asText() : body.toString();
    }

    static boolean isTextual(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        int parameters = type.indexOf(';');
        if (parameters >= 0) {
            type = type.substring(0, parameters);
        }
        type = type.trim();
        return type.startsWith("text/")
            || type.endsWith("/json") || type.endsWith("+json")
            || type.endsWith("/xml") || type.endsWith("+xml")
            || type.equals("application/javascript")
            || type.equals("application/x-www-form-urlencoded");
    }

    private static String utf8OrNull(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException ex) {
            return null;
        }
    }
}
