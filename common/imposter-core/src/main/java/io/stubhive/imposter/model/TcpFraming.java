package io.stubhive.imposter.model;

import io.stubhive.imposter.error.InvalidImposterException;
import java.nio.charset.StandardCharsets;

/**
 * Where one TCP request ends. Also applied to the origin's reply when a TCP
 * imposter proxies.
 *
 * @param type      framing rule
 * @param delimiter terminating byte sequence, only for {@link Type#DELIMITER}
 */
public record TcpFraming(Type type, String delimiter) {

    public enum Type {
        /** Every read from the socket is one request. */
        CHUNK("chunk"),
        /** A request ends at the delimiter, which is stripped. */
        DELIMITER("delimiter"),
        /** A request ends when the peer shuts down its output. */
        CLOSE("close");

        private final String wireValue;

        Type(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }

        public static Type fromWireValue(String value) {
            for (Type type : values()) {
                if (type.wireValue.equals(value)) {
                    return type;
                }
            }
            throw new InvalidImposterException("invalid tcp framing type: " + value);
        }
    }

    public TcpFraming {
        if (type == null) {
            throw new InvalidImposterException("framing.type is required");
        }
        if (type == Type.DELIMITER && (delimiter == null || delimiter.isEmpty())) {
            throw new InvalidImposterException("framing.delimiter is required for delimiter framing");
        }
        if (type != Type.DELIMITER) {
            delimiter = null;
        }
    }

    public static TcpFraming chunk() {
        return new TcpFraming(Type.CHUNK, null);
    }

    public static TcpFraming delimiter(String delimiter) {
        return new TcpFraming(Type.DELIMITER, delimiter);
    }

    public static TcpFraming close() {
        return new TcpFraming(Type.CLOSE, null);
    }

    public byte[] delimiterBytes() {
        return delimiter == null ? new byte[0] : delimiter.getBytes(StandardCharsets.UTF_8);
    }
}
