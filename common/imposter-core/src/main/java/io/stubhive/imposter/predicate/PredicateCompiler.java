package io.stubhive.imposter.predicate;

import com.fasterxml.jackson.databind.JsonNode;
import io.stubhive.imposter.error.InvalidImposterException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns predicate documents such as {@code {"equals": {"path": "/orders"}}}
 * into {@link RequestPredicate}s.
 * <p>
 * Field operators ({@code equals}, {@code deepEquals}, {@code contains},
 * {@code startsWith}, {@code endsWith}, {@code matches}, {@code exists}) take
 * an object of request fields. Logical operators combine other predicates:
 * {@code not} takes one, {@code or} and {@code and} take arrays. Matching is
 * case-insensitive unless {@code caseSensitive} is set; {@code except} is a
 * regular expression removed from request values before comparison.
 * <p>
 * Invalid documents fail with {@link InvalidImposterException} at compile time
 * so that a bad stub never reaches a live imposter.
 */
public final class PredicateCompiler {

    private static final Set<String> OPTION_KEYS = Set.of("caseSensitive", "except");

    private final PatternCache patterns = new PatternCache();

    public RequestPredicate compileAll(List<JsonNode> predicates) {
        List<RequestPredicate> compiled = new ArrayList<>(predicates.size());
        for (JsonNode predicate : predicates) {
            compiled.add(compile(predicate));
        }
        return RequestPredicate.allOf(compiled);
    }

    public RequestPredicate compile(JsonNode predicate) {
        if (predicate == null || !predicate.isObject()) {
            throw new InvalidImposterException("each predicate must be an object");
        }
        PredicateOperator operator = operatorOf(predicate);
        JsonNode argument = predicate.get(operator.key());
        return switch (operator) {
            case NOT -> {
                RequestPredicate inner = compile(argument);
                yield request -> !inner.matches(request);
            }
            case OR -> RequestPredicate.anyOf(compileList(argument, operator));
            case AND -> RequestPredicate.allOf(compileList(argument, operator));
            default -> fieldPredicate(operator, argument, predicate);
        };
    }

    private PredicateOperator operatorOf(JsonNode predicate) {
        PredicateOperator operator = null;
        Iterator<String> names = predicate.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (OPTION_KEYS.contains(name)) {
                continue;
            }
            PredicateOperator candidate = PredicateOperator.fromKey(name)
                .orElseThrow(() -> new InvalidImposterException("unrecognized predicate: " + name));
            if (operator != null) {
                throw new InvalidImposterException(
                    "a predicate takes exactly one operator, found " + operator.key() + " and " + name);
            }
            operator = candidate;
        }
        if (operator == null) {
            throw new InvalidImposterException("predicate has no operator: " + predicate);
        }
        return operator;
    }

    private List<RequestPredicate> compileList(JsonNode argument, PredicateOperator operator) {
        if (argument == null || !argument.isArray()) {
            throw new InvalidImposterException(operator.key() + " requires an array of predicates");
        }
        List<RequestPredicate> compiled = new ArrayList<>();
        for (JsonNode element : argument) {
            compiled.add(compile(element));
        }
        return compiled;
    }

    private RequestPredicate fieldPredicate(PredicateOperator operator, JsonNode argument, JsonNode predicate) {
        if (argument == null || !argument.isObject()) {
            throw new InvalidImposterException(operator.key() + " requires an object of request fields");
        }
        boolean caseSensitive = predicate.path("caseSensitive").asBoolean(false);
        Pattern except = null;
        JsonNode exceptNode = predicate.get("except");
        if (exceptNode != null && !exceptNode.asText().isEmpty()) {
            except = patterns.pattern(exceptNode.asText(), caseSensitive);
        }
        if (operator == PredicateOperator.MATCHES) {
            checkRegexes(argument, caseSensitive);
        }
        JsonNode expected = argument.deepCopy();
        FieldComparison comparison = new FieldComparison(operator, caseSensitive, except, patterns);
        return request -> comparison.fieldsMatch(expected, request);
    }

    private void checkRegexes(JsonNode node, boolean caseSensitive) {
        if (node.isContainerNode()) {
            for (JsonNode child : node) {
                checkRegexes(child, caseSensitive);
            }
        } else {
            patterns.pattern(node.asText(), caseSensitive);
        }
    }
}
