package com.remediation.domain.enums;

/**
 * How a trigger's name pattern is interpreted. All syntaxes compare case-insensitively.
 */
public enum PatternSyntax {

    /** {@code *} and {@code ?} wildcards, matched against the whole alert name. */
    GLOB,

    /** Java regular expression, found anywhere in the alert name. */
    REGEX,

    /** Whole-name equality. */
    EXACT,

    /** Substring match. */
    CONTAINS
}
