package io.stubhive.imposter.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * @param fields     protocol payload exactly as declared
 * @param waitMillis optional delay applied before the payload is returned
 */
public record IsResponse(ObjectNode fields, Long waitMillis) implements ResponseSpec {

    public IsResponse {
        fields = fields == null ? ImposterJson.objectNode() : fields.deepCopy();
    }

    public static IsResponse of(ObjectNode fields) {
        return new IsResponse(fields, null);
    }

    public boolean hasWait() {
        return waitMillis != null && waitMillis > 0;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIs(this);
    }
}
