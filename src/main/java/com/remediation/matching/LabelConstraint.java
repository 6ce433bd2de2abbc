package com.remediation.matching;

import com.remediation.domain.enums.LabelMatchOperator;
import com.remediation.domain.model.Alert;

/**
 * Constrains one alert label. Values compare case-sensitively; a missing label never matches.
 * Without an operator, a null value means EXISTS and anything else means EQUALS.
 */
public record LabelConstraint(String key, String value, LabelMatchOperator operator) implements TriggerConstraint {

    public static LabelConstraint equalTo(String key, String value) {
        return new LabelConstraint(key, value, LabelMatchOperator.EQUALS);
    }

    public static LabelConstraint containing(String key, String value) {
        return new LabelConstraint(key, value, LabelMatchOperator.CONTAINS);
    }

    public static LabelConstraint present(String key) {
        return new LabelConstraint(key, null, LabelMatchOperator.EXISTS);
    }

    @Override
    public boolean isSatisfiedBy(Alert alert, MatchContext context) {
        if (alert.getLabels() == null) {
            return false;
        }
        String actual = alert.getLabels().get(key);
        if (actual == null) {
            return false;
        }

        LabelMatchOperator effectiveOperator =
                operator != null ? operator : (value == null ? LabelMatchOperator.EXISTS : LabelMatchOperator.EQUALS);
        return switch (effectiveOperator) {
            case EXISTS -> true;
            case EQUALS -> actual.equals(value);
            case CONTAINS -> value != null && actual.contains(value);
        };
    }
}
