package com.remediation.matching;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.remediation.domain.model.Alert;

/**
 * One condition of a trigger's match predicate.
 *
 * <p>Each kind evaluates a single alert attribute; {@link PatternMatcher} ANDs them together.
 * Constraints are persisted as a JSON array, the {@code kind} property selecting the implementation.
 * Implementations are immutable and safe to share between threads.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = NamePatternConstraint.class, name = "name_pattern"),
    @JsonSubTypes.Type(value = SeverityConstraint.class, name = "severity"),
    @JsonSubTypes.Type(value = LabelConstraint.class, name = "label"),
    @JsonSubTypes.Type(value = TimeWindowConstraint.class, name = "time_window")
})
public interface TriggerConstraint {

    /**
     * @param context compiled-pattern cache and sink for captured variables
     * @throws java.util.regex.PatternSyntaxException if the constraint carries an invalid regular expression
     */
    boolean isSatisfiedBy(Alert alert, MatchContext context);
}
