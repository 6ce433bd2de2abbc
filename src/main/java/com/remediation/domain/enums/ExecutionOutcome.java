package com.remediation.domain.enums;

/**
 * Result of an action that was actually dispatched to the action runner.
 * Fed back to the circuit breaker; every value except SUCCEEDED and CANCELLED counts as a failure.
 */
public enum ExecutionOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    TRANSPORT_ERROR,
    CANCELLED;

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT || this == TRANSPORT_ERROR;
    }
}
