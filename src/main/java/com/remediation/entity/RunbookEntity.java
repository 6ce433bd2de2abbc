package com.remediation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the runbooks table. A null rate limit means the configured default applies.
 */
@Entity
@Table(name = "runbooks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunbookEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "target_scope_type")
    private String targetScopeType;

    @Column(name = "auto_execute", nullable = false)
    private boolean autoExecute;

    @Column(name = "approval_required", nullable = false)
    private boolean approvalRequired;

    @Column(name = "rate_limit_max_executions")
    private Integer rateLimitMaxExecutions;

    @Column(name = "rate_limit_window_seconds")
    private Long rateLimitWindowSeconds;

    @Column(name = "action_definition", columnDefinition = "TEXT")
    private String actionDefinition;

    @Column(name = "timeout_seconds")
    private Integer timeoutSeconds;
}
