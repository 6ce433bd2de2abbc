package com.remediation.matching;

import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.Trigger;
import java.util.Map;

/**
 * A matched trigger paired with the runbook it points at, resolved at match time, and the
 * variables captured by the trigger's patterns.
 */
public record TriggerCandidate(Trigger trigger, Runbook runbook, Map<String, String> variables) {

    public TriggerCandidate {
        variables = variables != null ? Map.copyOf(variables) : Map.of();
    }

    public TriggerCandidate(Trigger trigger, Runbook runbook) {
        this(trigger, runbook, Map.of());
    }
}
