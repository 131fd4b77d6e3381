package io.stubhive.imposter.stub;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;

/**
 * Ordered first-match lookup over an imposter's stubs.
 */
public final class StubMatcher {

    private StubMatcher() {
    }

    public static Optional<Stub> firstMatch(List<Stub> stubs, JsonNode request) {
        for (Stub stub : stubs) {
            if (stub.matches(request)) {
                return Optional.of(stub);
            }
        }
        return Optional.empty();
    }
}
