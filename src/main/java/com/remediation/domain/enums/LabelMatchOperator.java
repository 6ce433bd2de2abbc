package com.remediation.domain.enums;

/**
 * Comparison applied by a label constraint to the alert's label value.
 */
public enum LabelMatchOperator {
    EQUALS,
    CONTAINS,
    EXISTS
}
