package com.remediation.event;

import com.remediation.domain.enums.CircuitState;
import com.remediation.domain.model.ScopeKey;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every circuit breaker state transition.
 */
public class CircuitBreakerEvent extends ApplicationEvent {

    private final ScopeKey scope;
    private final CircuitState previousState;
    private final CircuitState currentState;
    private final String reason;

    public CircuitBreakerEvent(
            Object source, ScopeKey scope, CircuitState previousState, CircuitState currentState, String reason) {
        super(source);
        this.scope = scope;
        this.previousState = previousState;
        this.currentState = currentState;
        this.reason = reason;
    }

    public ScopeKey getScope() {
        return scope;
    }

    public CircuitState getPreviousState() {
        return previousState;
    }

    public CircuitState getCurrentState() {
        return currentState;
    }

    public String getReason() {
        return reason;
    }
}
