package com.remediation.support;

import com.remediation.domain.enums.AlertSeverity;
import com.remediation.domain.enums.ExecutionMode;
import com.remediation.domain.model.Alert;
import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.Trigger;
import com.remediation.matching.NamePatternConstraint;
import java.time.Instant;
import java.util.List;

/**
 * Builders for the alerts, triggers and runbooks most tests start from.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2025-03-10T10:00:00Z");

    private Fixtures() {}

    public static Alert alert(String name, String scope) {
        return Alert.builder()
                .id("alert-" + name + "-" + scope)
                .name(name)
                .severity(AlertSeverity.CRITICAL)
                .scope(scope)
                .source("prometheus")
                .receivedAt(NOW)
                .build();
    }

    public static Runbook autoRunbook(long id, String name) {
        return Runbook.builder()
                .id(id)
                .name(name)
                .enabled(true)
                .targetScopeType("host")
                .autoExecute(true)
                .actionDefinition("systemctl restart " + name)
                .build();
    }

    public static Trigger globTrigger(long id, String pattern, long runbookId, int priority) {
        return Trigger.builder()
                .id(id)
                .name("trigger-" + id)
                .enabled(true)
                .constraints(List.of(NamePatternConstraint.glob(pattern)))
                .runbookId(runbookId)
                .executionMode(ExecutionMode.AUTO)
                .priority(priority)
                .build();
    }
}
