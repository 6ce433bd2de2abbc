package com.remediation.event;

import com.remediation.domain.enums.CircuitState;
import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.model.Execution;
import com.remediation.domain.model.ScopeKey;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the remediation events.
 *
 * <p>Execution payloads are copied before publishing so listeners never observe later mutations.
 * Delivery is synchronous unless a listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Execution ----

    public void publishExecutionCreated(Object source, Execution execution) {
        applicationEventPublisher.publishEvent(
                new ExecutionEvent(source, execution.toBuilder().build(), ExecutionEventType.CREATED));
    }

    public void publishExecutionTransition(
            Object source, Execution execution, ExecutionEventType eventType, ExecutionStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new ExecutionEvent(source, execution.toBuilder().build(), eventType, previousStatus));
    }

    // ---- Circuit breaker ----

    public void publishCircuitTransition(
            Object source, ScopeKey scope, CircuitState previousState, CircuitState currentState, String reason) {
        applicationEventPublisher.publishEvent(
                new CircuitBreakerEvent(source, scope, previousState, currentState, reason));
    }

    // ---- Configuration ----

    public void publishTriggerConfigurationError(Object source, Long triggerId, String alertId, String message) {
        applicationEventPublisher.publishEvent(new TriggerConfigurationEvent(source, triggerId, alertId, message));
    }
}
