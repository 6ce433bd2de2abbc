package com.remediation.domain.model;

import com.remediation.domain.enums.ExecutionOutcome;
import com.remediation.domain.enums.ExecutionStatus;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * One concrete attempt, or gated refusal, to run a runbook in response to an alert.
 *
 * <p>Alert, trigger and runbook data are snapshotted at creation. Status and timestamps are
 * changed only through {@link com.remediation.orchestration.ExecutionStateManager}, once per
 * transition, and never after a terminal status.
 */
@Data
@Builder(toBuilder = true)
public class Execution {

    private String id;

    private String alertId;
    private String alertName;

    private Long triggerId;
    private String triggerName;
    private int triggerPriority;

    private Long runbookId;
    private String runbookName;

    private String scopeType;
    private String scopeId;

    private ExecutionStatus status;

    /** Set only for executions that reached the action runner. */
    private ExecutionOutcome outcome;

    private String outcomeDetail;

    /** True when admitted as the single probe of a HALF_OPEN circuit breaker. */
    private boolean probe;

    private Runbook runbookSnapshot;

    /** Alert-derived variables handed to the action runner. */
    private Map<String, String> variables;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant approvalExpiresAt;

    /** Operator who approved, rejected or cancelled the execution. */
    private String decidedBy;

    public ScopeKey getScopeKey() {
        return new ScopeKey(scopeType, scopeId);
    }
}
