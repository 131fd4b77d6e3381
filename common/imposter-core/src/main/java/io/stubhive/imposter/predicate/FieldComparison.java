package io.stubhive.imposter.predicate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.stubhive.imposter.model.ImposterJson;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Compares the expected fields of one field predicate against a request.
 * Missing request fields compare as the empty string. Arrays in the request
 * match when any element matches, except under {@code deepEquals}.
 */
final class FieldComparison {

    private final PredicateOperator operator;
    private final boolean caseSensitive;
    private final Pattern except;
    private final PatternCache patterns;

    FieldComparison(PredicateOperator operator, boolean caseSensitive, Pattern except, PatternCache patterns) {
        this.operator = operator;
        this.caseSensitive = caseSensitive;
        this.except = except;
        this.patterns = patterns;
    }

    boolean fieldsMatch(JsonNode expected, JsonNode actual) {
        Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!valueMatches(field.getValue(), field(actual, field.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private boolean valueMatches(JsonNode expected, JsonNode actual) {
        if (operator == PredicateOperator.EXISTS) {
            return existsMatches(expected, actual);
        }
        JsonNode value = structured(expected, actual);
        if (expected.isObject()) {
            return objectMatches(expected, value);
        }
        if (expected.isArray()) {
            return arrayMatches(expected, value);
        }
        if (value != null && value.isArray()) {
            if (operator == PredicateOperator.DEEP_EQUALS) {
                return false;
            }
            for (JsonNode element : value) {
                if (scalarMatches(expected, element)) {
                    return true;
                }
            }
            return false;
        }
        return scalarMatches(expected, value);
    }

    private boolean objectMatches(JsonNode expected, JsonNode actual) {
        if (actual != null && actual.isArray() && operator != PredicateOperator.DEEP_EQUALS) {
            for (JsonNode element : actual) {
                if (objectMatches(expected, element)) {
                    return true;
                }
            }
            return false;
        }
        if (operator == PredicateOperator.DEEP_EQUALS) {
            return actual != null && actual.isObject()
                && actual.size() == expected.size()
                && fieldsMatch(expected, actual);
        }
        return fieldsMatch(expected, actual);
    }

    private boolean arrayMatches(JsonNode expected, JsonNode actual) {
        if (actual == null || !actual.isArray()) {
            return false;
        }
        if (operator == PredicateOperator.DEEP_EQUALS && actual.size() != expected.size()) {
            return false;
        }
        for (JsonNode wanted : expected) {
            boolean found = false;
            for (JsonNode element : actual) {
                if (valueMatches(wanted, element)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private boolean scalarMatches(JsonNode expected, JsonNode actual) {
        String raw = stripExcept(text(actual));
        if (operator == PredicateOperator.MATCHES) {
            return patterns.pattern(expected.asText(), caseSensitive).matcher(raw).find();
        }
        String want = normalize(expected.asText());
        String have = normalize(raw);
        return switch (operator) {
            case EQUALS, DEEP_EQUALS -> have.equals(want);
            case CONTAINS -> have.contains(want);
            case STARTS_WITH -> have.startsWith(want);
            case ENDS_WITH -> have.endsWith(want);
            default -> false;
        };
    }

    private boolean existsMatches(JsonNode expected, JsonNode actual) {
        if (expected.isObject()) {
            return fieldsMatch(expected, structured(expected, actual));
        }
        boolean present = actual != null
            && !actual.isMissingNode()
            && !actual.isNull()
            && !(actual.isTextual() && actual.asText().isEmpty())
            && !(actual.isContainerNode() && actual.size() == 0);
        return expected.asBoolean() == present;
    }

    private JsonNode field(JsonNode actual, String key) {
        if (actual == null || !actual.isObject()) {
            return null;
        }
        JsonNode direct = actual.get(key);
        if (direct != null || caseSensitive) {
            return direct;
        }
        Iterator<String> names = actual.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (name.equalsIgnoreCase(key)) {
                return actual.get(name);
            }
        }
        return null;
    }

    // a JSON body arrives as text; parse it when the predicate expects structure
    private static JsonNode structured(JsonNode expected, JsonNode actual) {
        if (actual == null || !actual.isTextual() || !expected.isContainerNode()) {
            return actual;
        }
        try {
            JsonNode parsed = ImposterJson.mapper().readTree(actual.asText());
            return parsed != null && parsed.isContainerNode() ? parsed : actual;
        } catch (JsonProcessingException ex) {
            return actual;
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        return node.isContainerNode() ? node.toString() : node.asText();
    }

    private String stripExcept(String value) {
        return except == null ? value : except.matcher(value).replaceAll("");
    }

    private String normalize(String value) {
        return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
    }
}
