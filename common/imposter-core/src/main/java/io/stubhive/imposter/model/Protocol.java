package io.stubhive.imposter.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.InvalidProtocolException;
import java.util.Locale;

/**
 * The closed set of protocols an imposter can speak.
 */
public enum Protocol {
    HTTP("http"),
    TCP("tcp"),
    SMTP("smtp");

    private final String wireValue;

    Protocol(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Protocol fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidProtocolException(String.valueOf(value));
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Protocol protocol : values()) {
            if (protocol.wireValue.equals(normalized)) {
                return protocol;
            }
        }
        throw new InvalidProtocolException(value);
    }

    /**
     * Whether {@code proxy} responses can be forwarded for this protocol.
     */
    public boolean supportsProxy() {
        return this != SMTP;
    }

    /**
     * The payload sent when no stub matches, before the imposter's own
     * {@code defaultResponse} is layered on top.
     */
    public ObjectNode defaultPayload() {
        ObjectNode payload = ImposterJson.objectNode();
        switch (this) {
            case HTTP -> {
                payload.put("statusCode", 200);
                payload.set("headers", ImposterJson.objectNode());
                payload.put("body", "");
            }
            case TCP -> payload.put("data", "");
            case SMTP -> {
                payload.put("code", 250);
                payload.put("message", "OK: queued");
            }
        }
        return payload;
    }

    /**
     * Response used when a proxied origin could not be reached or a computed response failed.
     */
    public ImposterResponse errorResponse(String code, String message) {
        return switch (this) {
            case HTTP -> ImposterResponse.of(httpError(code, message));
            case SMTP -> {
                ObjectNode payload = ImposterJson.objectNode();
                payload.put("code", 451);
                payload.put("message", message);
                yield ImposterResponse.of(payload);
            }
            case TCP -> ImposterResponse.connectionReset();
        };
    }

    private static ObjectNode httpError(String code, String message) {
        ObjectNode error = ImposterJson.objectNode();
        error.put("code", code);
        error.put("message", message);
        ObjectNode body = ImposterJson.objectNode();
        ArrayNode errors = body.putArray("errors");
        errors.add(error);
        ObjectNode payload = ImposterJson.objectNode();
        payload.put("statusCode", 500);
        payload.putObject("headers").put("Content-Type", "application/json");
        payload.set("body", body);
        return payload;
    }
}
