package io.stubhive.imposter.model;

import io.stubhive.imposter.error.InvalidImposterException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * How TCP payloads are represented in requests, responses and documents.
 */
public enum TcpMode {
    TEXT("text"),
    BINARY("binary");

    private final String wireValue;

    TcpMode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static TcpMode fromWireValue(String value) {
        for (TcpMode mode : values()) {
            if (mode.wireValue.equals(value)) {
                return mode;
            }
        }
        throw new InvalidImposterException("invalid tcp mode: " + value);
    }

    public String encode(byte[] bytes) {
        return this == BINARY
            ? Base64.getEncoder().encodeToString(bytes)
            : new String(bytes, StandardCharsets.UTF_8);
    }

    public byte[] decode(String data) {
        if (data == null) {
            return new byte[0];
        }
        if (this == BINARY) {
            try {
                return Base64.getDecoder().decode(data);
            } catch (IllegalArgumentException ex) {
                throw new InvalidImposterException("binary data must be base64 encoded", ex);
            }
        }
        return data.getBytes(StandardCharsets.UTF_8);
    }
}
