package io.stubhive.imposter.predicate;

import io.stubhive.imposter.error.InvalidImposterException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

final class PatternCache {

    private final Map<String, Pattern> compiledPatterns = new ConcurrentHashMap<>();

    Pattern pattern(String regex, boolean caseSensitive) {
        String key = (caseSensitive ? "s:" : "i:") + regex;
        return compiledPatterns.computeIfAbsent(key, ignored -> compile(regex, caseSensitive));
    }

    private static Pattern compile(String regex, boolean caseSensitive) {
        try {
            return caseSensitive ? Pattern.compile(regex) : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException ex) {
            throw new InvalidImposterException("invalid regular expression: " + regex, ex);
        }
    }
}
