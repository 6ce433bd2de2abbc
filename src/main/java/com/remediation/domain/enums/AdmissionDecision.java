package com.remediation.domain.enums;

/**
 * Circuit breaker answer to an admission request.
 */
public enum AdmissionDecision {
    ALLOW,
    ALLOW_AS_PROBE,
    DENY;

    public boolean isAllowed() {
        return this != DENY;
    }
}
