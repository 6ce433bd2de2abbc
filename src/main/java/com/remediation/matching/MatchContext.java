package com.remediation.matching;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-evaluation state handed to {@link TriggerConstraint}s: the shared compiled-pattern cache and
 * the variables captured while matching one trigger against one alert.
 */
public final class MatchContext {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final PatternMatcher patternMatcher;
    private final Map<String, String> variables = new LinkedHashMap<>();

    MatchContext(PatternMatcher patternMatcher) {
        this.patternMatcher = patternMatcher;
    }

    public Pattern compile(String regex, int flags) {
        return patternMatcher.compile(regex, flags);
    }

    /** Records every named group of a successful match that captured a value. */
    public void captureNamedGroups(Matcher matcher) {
        Matcher names = GROUP_NAME.matcher(matcher.pattern().pattern());
        while (names.find()) {
            String name = names.group(1);
            String value;
            try {
                value = matcher.group(name);
            } catch (IllegalArgumentException e) {
                // escaped "\(?<" text, not a group
                continue;
            }
            if (value != null) {
                variables.put(name, value);
            }
        }
    }

    public Map<String, String> variables() {
        return Collections.unmodifiableMap(variables);
    }
}
