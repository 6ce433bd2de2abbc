package com.remediation.domain.enums;

/**
 * Lifecycle state of an alert as reported by the monitoring source.
 */
public enum AlertStatus {
    FIRING,
    RESOLVED
}
