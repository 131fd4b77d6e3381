package io.stubhive.imposter.predicate;

import java.util.Optional;

enum PredicateOperator {
    EQUALS("equals"),
    DEEP_EQUALS("deepEquals"),
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    MATCHES("matches"),
    EXISTS("exists"),
    NOT("not"),
    OR("or"),
    AND("and");

    private final String key;

    PredicateOperator(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    static Optional<PredicateOperator> fromKey(String key) {
        for (PredicateOperator operator : values()) {
            if (operator.key.equals(key)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
