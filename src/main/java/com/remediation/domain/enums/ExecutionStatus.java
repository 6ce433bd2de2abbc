package com.remediation.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a runbook execution (or of a gated refusal to execute).
 *
 * <p>Allowed transitions:
 * <pre>
 *   APPROVAL_REQUIRED -> PENDING (approved) | SKIPPED (rejected, cancelled, expired)
 *   PENDING           -> RUNNING (dequeued by a worker) | SKIPPED (cancelled)
 *   RUNNING           -> SUCCEEDED | FAILED
 * </pre>
 * CIRCUIT_OPEN and RATE_LIMITED are created terminal.
 */
public enum ExecutionStatus {
    PENDING,
    APPROVAL_REQUIRED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    CIRCUIT_OPEN,
    RATE_LIMITED;

    private static final Set<ExecutionStatus> TERMINAL =
            EnumSet.of(SUCCEEDED, FAILED, SKIPPED, CIRCUIT_OPEN, RATE_LIMITED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
