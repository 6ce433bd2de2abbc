package com.remediation.domain.enums;

/**
 * Rate limiter answer to an admission request.
 */
public enum RateLimitDecision {
    ALLOW,
    DENY
}
