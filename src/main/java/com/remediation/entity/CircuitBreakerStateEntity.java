package com.remediation.entity;

import com.remediation.domain.enums.CircuitState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the circuit_breaker_states table, one row per (scope type, scope id).
 */
@Entity
@Table(
        name = "circuit_breaker_states",
        uniqueConstraints = @UniqueConstraint(name = "uk_breaker_scope", columnNames = {"scope_type", "scope_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CircuitBreakerStateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scope_type", nullable = false)
    private String scopeType;

    @Column(name = "scope_id", nullable = false)
    private String scopeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "varchar(20)")
    private CircuitState state;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "trip_count", nullable = false)
    private int tripCount;

    @Column(name = "last_transition_at")
    private Instant lastTransitionAt;

    @Column(name = "open_until")
    private Instant openUntil;

    @Column(name = "probe_execution_id", length = 36)
    private String probeExecutionId;

    @Column(name = "probe_started_at")
    private Instant probeStartedAt;

    @Column(name = "manually_opened", nullable = false)
    private boolean manuallyOpened;

    @Column(name = "manual_reason")
    private String manualReason;

    @Column(name = "recent_execution_ids", columnDefinition = "TEXT")
    private String recentExecutionIds;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
