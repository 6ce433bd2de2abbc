package com.remediation.domain.enums;

/**
 * Per-scope circuit breaker state.
 */
public enum CircuitState {

    /** Normal operation, executions allowed. */
    CLOSED,

    /** Executions denied until the open-until timestamp elapses. */
    OPEN,

    /** One probe execution allowed to test recovery. */
    HALF_OPEN
}
