package com.remediation.exception;

import java.util.Map;

/**
 * A trigger or runbook definition that cannot be evaluated: invalid pattern, missing or disabled
 * runbook, rate limit without a window. The alert is still processed against the other triggers.
 */
public class TriggerConfigurationException extends BaseException {

    public TriggerConfigurationException(Long triggerId, String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message, Map.of("triggerId", String.valueOf(triggerId)));
    }

    public static TriggerConfigurationException forRunbook(Long runbookId, String message) {
        return new TriggerConfigurationException(message, Map.of("runbookId", String.valueOf(runbookId)));
    }

    private TriggerConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }

    public TriggerConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
