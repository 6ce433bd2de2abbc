package com.remediation.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when a trigger is skipped during matching because its definition is unusable.
 */
public class TriggerConfigurationEvent extends ApplicationEvent {

    private final Long triggerId;
    private final String alertId;
    private final String message;

    public TriggerConfigurationEvent(Object source, Long triggerId, String alertId, String message) {
        super(source);
        this.triggerId = triggerId;
        this.alertId = alertId;
        this.message = message;
    }

    public Long getTriggerId() {
        return triggerId;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getMessage() {
        return message;
    }
}
