package com.remediation.circuit;

import com.remediation.domain.model.CircuitBreakerState;
import com.remediation.domain.model.ScopeKey;
import java.util.Optional;

/**
 * Persistence seam for per-scope breaker state. Callers serialize access per key;
 * implementations only need plain load/save and must raise
 * {@link com.remediation.exception.StateReadException} when the store is unavailable.
 */
public interface CircuitBreakerStateStore {

    Optional<CircuitBreakerState> load(ScopeKey scope);

    CircuitBreakerState save(CircuitBreakerState state);
}
