package com.remediation.event;

/**
 * Lifecycle step an {@link ExecutionEvent} reports.
 */
public enum ExecutionEventType {
    CREATED,
    APPROVED,
    REJECTED,
    STARTED,
    COMPLETED,
    CANCELLED,
    EXPIRED
}
