package com.remediation.matching;

import com.remediation.domain.enums.PatternSyntax;
import com.remediation.domain.model.Alert;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches the alert name against a glob, regex, exact or substring pattern, ignoring case.
 *
 * <p>A regex can turn case sensitivity back on with the inline flag {@code (?-i)}. Its named
 * groups ({@code (?<service>\w+)Down}) become execution variables.
 * A blank pattern leaves the name unconstrained.
 */
public record NamePatternConstraint(String pattern, PatternSyntax syntax) implements TriggerConstraint {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public static NamePatternConstraint glob(String pattern) {
        return new NamePatternConstraint(pattern, PatternSyntax.GLOB);
    }

    public static NamePatternConstraint regex(String pattern) {
        return new NamePatternConstraint(pattern, PatternSyntax.REGEX);
    }

    @Override
    public boolean isSatisfiedBy(Alert alert, MatchContext context) {
        if (pattern == null || pattern.isBlank()) {
            return true;
        }
        String name = alert.getName();
        if (name == null) {
            return false;
        }

        PatternSyntax effectiveSyntax = syntax != null ? syntax : PatternSyntax.GLOB;
        return switch (effectiveSyntax) {
            case GLOB -> context.compile(globToRegex(pattern), FLAGS).matcher(name).matches();
            case REGEX -> {
                Matcher matcher = context.compile(pattern, FLAGS).matcher(name);
                if (!matcher.find()) {
                    yield false;
                }
                context.captureNamedGroups(matcher);
                yield true;
            }
            case EXACT -> name.equalsIgnoreCase(pattern);
            case CONTAINS -> name.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
        };
    }

    /** Translates {@code *} and {@code ?} to regex, quoting every other character. */
    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }
}
