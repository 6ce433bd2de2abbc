package com.remediation.domain.model;

import com.remediation.domain.enums.ExecutionMode;
import com.remediation.matching.TriggerConstraint;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Operator-defined rule mapping alert criteria to a runbook.
 *
 * <p>All constraints must hold for a match; an empty list matches every alert.
 * Higher {@code priority} is evaluated first.
 */
@Data
@Builder
public class Trigger {

    private Long id;
    private String name;
    private boolean enabled;

    @Builder.Default
    private List<TriggerConstraint> constraints = List.of();

    private Long runbookId;

    @Builder.Default
    private ExecutionMode executionMode = ExecutionMode.AUTO;

    private int priority;
}
