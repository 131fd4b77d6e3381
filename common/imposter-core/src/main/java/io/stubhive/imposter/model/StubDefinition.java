package io.stubhive.imposter.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Declared form of a stub: predicate documents kept verbatim plus the
 * response sequence.
 */
public record StubDefinition(List<JsonNode> predicates, List<ResponseSpec> responses) {

    public StubDefinition {
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
        responses = responses == null ? List.of() : List.copyOf(responses);
    }

    public static StubDefinition respondingWith(ResponseSpec... responses) {
        return new StubDefinition(List.of(), List.of(responses));
    }
}
