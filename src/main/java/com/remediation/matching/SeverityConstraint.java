package com.remediation.matching;

import com.remediation.domain.enums.AlertSeverity;
import com.remediation.domain.model.Alert;
import java.util.Set;

/**
 * Requires the alert severity to be one of the listed severities. An empty set accepts any severity.
 */
public record SeverityConstraint(Set<AlertSeverity> severities) implements TriggerConstraint {

    public static SeverityConstraint of(AlertSeverity... severities) {
        return new SeverityConstraint(Set.of(severities));
    }

    @Override
    public boolean isSatisfiedBy(Alert alert, MatchContext context) {
        if (severities == null || severities.isEmpty()) {
            return true;
        }
        return alert.getSeverity() != null && severities.contains(alert.getSeverity());
    }
}
