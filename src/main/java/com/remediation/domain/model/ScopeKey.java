package com.remediation.domain.model;

import java.util.Objects;

/**
 * Identifies the infrastructure target a circuit breaker protects: the runbook's scope type
 * plus the alert's scope identifier.
 */
public record ScopeKey(String scopeType, String scopeId) {

    public ScopeKey {
        Objects.requireNonNull(scopeType, "scopeType");
        Objects.requireNonNull(scopeId, "scopeId");
    }

    @Override
    public String toString() {
        return scopeType + ":" + scopeId;
    }
}
