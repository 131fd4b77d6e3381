package io.stubhive.imposter.predicate;

import static io.stubhive.imposter.support.Json.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.stubhive.imposter.error.InvalidImposterException;
import java.util.List;
import org.junit.jupiter.api.Test;

class PredicateCompilerTest {

    private final PredicateCompiler compiler = new PredicateCompiler();

    private final JsonNode request = json("""
        {
          "method": "POST",
          "path": "/orders",
          "query": {"id": "42"},
          "headers": {"Content-Type": "application/json"},
          "body": "{\\"customer\\": {\\"name\\": \\"Ada\\"}}"
        }
        """);

    private boolean matches(String predicate) {
        return compiler.compile(json(predicate)).matches(request);
    }

    @Test
    void equalsIgnoresCaseUnlessAskedNotTo() {
        assertThat(matches("{\"equals\": {\"path\": \"/orders\"}}")).isTrue();
        assertThat(matches("{\"equals\": {\"path\": \"/ORDERS\"}}")).isTrue();
        assertThat(matches("{\"equals\": {\"path\": \"/ORDERS\"}, \"caseSensitive\": true}")).isFalse();
        assertThat(matches("{\"equals\": {\"method\": \"GET\"}}")).isFalse();
    }

    @Test
    void nestedKeysAreMatchedCaseInsensitively() {
        assertThat(matches("{\"equals\": {\"headers\": {\"content-type\": \"application/json\"}}}")).isTrue();
        assertThat(matches("{\"equals\": {\"query\": {\"id\": \"42\"}}}")).isTrue();
        assertThat(matches("{\"equals\": {\"query\": {\"id\": \"43\"}}}")).isFalse();
    }

    @Test
    void stringOperators() {
        assertThat(matches("{\"contains\": {\"body\": \"Ada\"}}")).isTrue();
        assertThat(matches("{\"startsWith\": {\"path\": \"/ord\"}}")).isTrue();
        assertThat(matches("{\"endsWith\": {\"path\": \"ers\"}}")).isTrue();
        assertThat(matches("{\"endsWith\": {\"path\": \"/ord\"}}")).isFalse();
        assertThat(matches("{\"matches\": {\"path\": \"^/ORD.*s$\"}}")).isTrue();
        assertThat(matches("{\"matches\": {\"path\": \"^/ORD.*s$\"}, \"caseSensitive\": true}")).isFalse();
    }

    @Test
    void existsComparesPresence() {
        assertThat(matches("{\"exists\": {\"query\": {\"id\": true, \"page\": false}}}")).isTrue();
        assertThat(matches("{\"exists\": {\"body\": false}}")).isFalse();
        assertThat(matches("{\"exists\": {\"headers\": {\"Authorization\": true}}}")).isFalse();
    }

    @Test
    void deepEqualsRequiresTheWholeObject() {
        assertThat(matches("{\"deepEquals\": {\"query\": {\"id\": \"42\"}}}")).isTrue();
        assertThat(matches("{\"deepEquals\": {\"query\": {\"id\": \"42\", \"page\": \"1\"}}}")).isFalse();
        assertThat(matches("{\"equals\": {\"query\": {}}}")).isTrue();
        assertThat(matches("{\"deepEquals\": {\"query\": {}}}")).isFalse();
    }

    @Test
    void objectExpectationsParseJsonBodies() {
        assertThat(matches("{\"equals\": {\"body\": {\"customer\": {\"name\": \"ada\"}}}}")).isTrue();
        assertThat(matches("{\"equals\": {\"body\": {\"customer\": {\"name\": \"Lin\"}}}}")).isFalse();
    }

    @Test
    void exceptIsRemovedBeforeComparing() {
        JsonNode numbered = json("{\"body\": \"hello123\"}");
        RequestPredicate predicate = compiler.compile(json("{\"equals\": {\"body\": \"hello\"}, \"except\": \"\\\\d+\"}"));
        assertThat(predicate.matches(numbered)).isTrue();
    }

    @Test
    void arraysMatchWhenAnyElementMatches() {
        JsonNode tagged = json("{\"tags\": [\"a\", \"b\"]}");
        assertThat(compiler.compile(json("{\"equals\": {\"tags\": \"b\"}}")).matches(tagged)).isTrue();
        assertThat(compiler.compile(json("{\"deepEquals\": {\"tags\": [\"b\", \"a\"]}}")).matches(tagged)).isTrue();
        assertThat(compiler.compile(json("{\"deepEquals\": {\"tags\": \"b\"}}")).matches(tagged)).isFalse();
        assertThat(compiler.compile(json("{\"deepEquals\": {\"tags\": [\"a\"]}}")).matches(tagged)).isFalse();
    }

    @Test
    void logicalOperatorsCombinePredicates() {
        assertThat(matches("{\"not\": {\"equals\": {\"method\": \"GET\"}}}")).isTrue();
        assertThat(matches("{\"or\": [{\"equals\": {\"method\": \"GET\"}}, {\"equals\": {\"method\": \"POST\"}}]}")).isTrue();
        assertThat(matches("{\"and\": [{\"equals\": {\"method\": \"POST\"}}, {\"equals\": {\"path\": \"/other\"}}]}")).isFalse();
    }

    @Test
    void emptyListMatchesEverything() {
        assertThat(compiler.compileAll(List.of()).matches(request)).isTrue();
        assertThat(compiler.compileAll(List.of(
            json("{\"equals\": {\"method\": \"POST\"}}"),
            json("{\"equals\": {\"path\": \"/nope\"}}"))).matches(request)).isFalse();
    }

    @Test
    void rejectsInvalidPredicates() {
        assertThatThrownBy(() -> compiler.compile(json("{\"equal\": {\"path\": \"/\"}}")))
            .isInstanceOf(InvalidImposterException.class)
            .hasMessageContaining("equal");
        assertThatThrownBy(() -> compiler.compile(json("{\"equals\": {\"path\": \"/\"}, \"contains\": {\"body\": \"x\"}}")))
            .isInstanceOf(InvalidImposterException.class);
        assertThatThrownBy(() -> compiler.compile(json("{\"caseSensitive\": true}")))
            .isInstanceOf(InvalidImposterException.class);
        assertThatThrownBy(() -> compiler.compile(json("{\"matches\": {\"path\": \"(\"}}")))
            .isInstanceOf(InvalidImposterException.class);
        assertThatThrownBy(() -> compiler.compile(json("{\"or\": {}}")))
            .isInstanceOf(InvalidImposterException.class);
        assertThatThrownBy(() -> compiler.compile(json("{\"equals\": \"/\"}")))
            .isInstanceOf(InvalidImposterException.class);
        assertThatThrownBy(() -> compiler.compile(json("[]")))
            .isInstanceOf(InvalidImposterException.class);
    }
}
