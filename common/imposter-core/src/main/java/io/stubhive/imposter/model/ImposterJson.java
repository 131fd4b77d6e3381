package io.stubhive.imposter.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Iterator;
import java.util.Map;

/**
 * Shared Jackson configuration for every document the engine reads or writes.
 */
public final class ImposterJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ImposterJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode objectNode() {
        return MAPPER.createObjectNode();
    }

    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    /**
     * Shallow merge: fields of later layers replace fields of earlier ones.
     * Null layers are skipped and no layer is modified.
     */
    public static ObjectNode merge(ObjectNode... layers) {
        ObjectNode result = objectNode();
        for (ObjectNode layer : layers) {
            if (layer == null) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = layer.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                result.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return result;
    }
}
