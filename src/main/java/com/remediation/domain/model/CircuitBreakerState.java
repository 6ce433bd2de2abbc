package com.remediation.domain.model;

import com.remediation.domain.enums.CircuitState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Persistent circuit breaker state for one scope.
 *
 * <p>Created lazily on the first outcome for a scope and never deleted. Only
 * {@link com.remediation.circuit.CircuitBreakerService} reads or writes it.
 */
@Data
@Builder(toBuilder = true)
public class CircuitBreakerState {

    private Long id;
    private String scopeType;
    private String scopeId;

    @Builder.Default
    private CircuitState state = CircuitState.CLOSED;

    private int consecutiveFailures;

    /** Number of consecutive times the breaker opened without closing in between. Drives backoff. */
    private int tripCount;

    private Instant lastTransitionAt;

    /** Null while CLOSED or when manually opened. */
    private Instant openUntil;

    /** Execution currently probing a HALF_OPEN breaker, if any. */
    private String probeExecutionId;

    private Instant probeStartedAt;

    private boolean manuallyOpened;
    private String manualReason;

    /** Most recent execution ids whose outcome was recorded, oldest first. Guards replays. */
    @Builder.Default
    private List<String> recentExecutionIds = new ArrayList<>();

    private Instant updatedAt;

    public ScopeKey getScopeKey() {
        return new ScopeKey(scopeType, scopeId);
    }

    public static CircuitBreakerState closed(ScopeKey scope, Instant now) {
        return CircuitBreakerState.builder()
                .scopeType(scope.scopeType())
                .scopeId(scope.scopeId())
                .state(CircuitState.CLOSED)
                .lastTransitionAt(now)
                .updatedAt(now)
                .build();
    }
}
