package com.remediation.entity;

import com.remediation.domain.enums.ExecutionOutcome;
import com.remediation.domain.enums.ExecutionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the executions table, the durable execution history.
 *
 * <p>The runbook snapshot and the alert variables are JSON copies taken at creation.
 */
@Entity
@Table(
        name = "executions",
        indexes = {
            @Index(name = "idx_executions_status", columnList = "status"),
            @Index(name = "idx_executions_scope", columnList = "scope_type, scope_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "alert_id")
    private String alertId;

    @Column(name = "alert_name")
    private String alertName;

    @Column(name = "trigger_id")
    private Long triggerId;

    @Column(name = "trigger_name")
    private String triggerName;

    @Column(name = "trigger_priority", nullable = false)
    private int triggerPriority;

    @Column(name = "runbook_id")
    private Long runbookId;

    @Column(name = "runbook_name")
    private String runbookName;

    @Column(name = "scope_type", nullable = false)
    private String scopeType;

    @Column(name = "scope_id", nullable = false)
    private String scopeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(30)")
    private ExecutionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(30)")
    private ExecutionOutcome outcome;

    @Column(name = "outcome_detail", columnDefinition = "TEXT")
    private String outcomeDetail;

    @Column(nullable = false)
    private boolean probe;

    @Column(name = "runbook_snapshot", columnDefinition = "TEXT")
    private String runbookSnapshot;

    @Column(columnDefinition = "TEXT")
    private String variables;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "approval_expires_at")
    private Instant approvalExpiresAt;

    @Column(name = "decided_by")
    private String decidedBy;
}
