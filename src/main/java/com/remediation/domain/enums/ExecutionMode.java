package com.remediation.domain.enums;

/**
 * How a trigger wants its runbook executed once matched.
 * APPROVAL_REQUIRED forces an operator decision even if the runbook itself allows auto-execution.
 */
public enum ExecutionMode {
    AUTO,
    APPROVAL_REQUIRED
}
