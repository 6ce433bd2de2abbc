package com.remediation.event;

import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.model.Execution;
import org.springframework.context.ApplicationEvent;

/**
 * Published whenever an execution is created or changes status.
 *
 * <p>Carries a copy of the execution taken right after the change, plus the status it had
 * before (null for CREATED).
 */
public class ExecutionEvent extends ApplicationEvent {

    private final Execution execution;
    private final ExecutionEventType eventType;
    private final ExecutionStatus previousStatus;

    public ExecutionEvent(Object source, Execution execution, ExecutionEventType eventType) {
        this(source, execution, eventType, null);
    }

    public ExecutionEvent(
            Object source, Execution execution, ExecutionEventType eventType, ExecutionStatus previousStatus) {
        super(source);
        this.execution = execution;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public Execution getExecution() {
        return execution;
    }

    public ExecutionEventType getEventType() {
        return eventType;
    }

    public ExecutionStatus getPreviousStatus() {
        return previousStatus;
    }
}
