package com.taintgrep.engine.pattern;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled regexes shared by one matcher. Compile errors surface as
 * {@link MatchException}.
 */
class RegexCache {
    private final Map<String, Pattern> compiled = new HashMap<>();

    Pattern get(String regex) {
        Pattern pattern = compiled.get(regex);
        if (pattern == null) {
            try {
                pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new MatchException("Invalid regex '" + regex + "': " + e.getDescription(), e);
            }
            compiled.put(regex, pattern);
        }
        return pattern;
    }

    boolean find(String regex, String text) {
        return get(regex).matcher(text).find();
    }
}
