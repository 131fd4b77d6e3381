package io.stubhive.imposter.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A concrete response ready for a protocol adapter to encode.
 *
 * @param payload protocol fields ({@code statusCode}/{@code headers}/{@code body},
 *                {@code data}, or {@code code}/{@code message})
 * @param reset   when {@code true} the adapter drops the connection instead of
 *                writing a payload
 */
public record ImposterResponse(ObjectNode payload, boolean reset) {

    public ImposterResponse {
        if (!reset) {
            Objects.requireNonNull(payload, "payload");
        }
    }

    public static ImposterResponse of(ObjectNode payload) {
        return new ImposterResponse(payload, false);
    }

    public static ImposterResponse connectionReset() {
        return new ImposterResponse(null, true);
    }
}
