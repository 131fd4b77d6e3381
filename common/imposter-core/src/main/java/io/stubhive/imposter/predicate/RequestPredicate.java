package io.stubhive.imposter.predicate;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A compiled predicate evaluated against the JSON form of a request.
 */
@FunctionalInterface
public interface RequestPredicate {

    RequestPredicate ALWAYS = request -> true;

    boolean matches(JsonNode request);

    static RequestPredicate allOf(List<RequestPredicate> predicates) {
        if (predicates.isEmpty()) {
            return ALWAYS;
        }
        List<RequestPredicate> copy = List.copyOf(predicates);
        return request -> {
            for (RequestPredicate predicate : copy) {
                if (!predicate.matches(request)) {
                    return false;
                }
            }
            return true;
        };
    }

    static RequestPredicate anyOf(List<RequestPredicate> predicates) {
        List<RequestPredicate> copy = List.copyOf(predicates);
        return request -> {
            for (RequestPredicate predicate : copy) {
                if (predicate.matches(request)) {
                    return true;
                }
            }
            return false;
        };
    }
}
