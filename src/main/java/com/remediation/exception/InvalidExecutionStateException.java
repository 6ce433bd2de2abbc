package com.remediation.exception;

import com.remediation.domain.enums.ExecutionStatus;
import java.util.Map;

/**
 * Thrown when an operator action (approve, reject, cancel) does not fit the execution's current status.
 */
public class InvalidExecutionStateException extends BaseException {

    public InvalidExecutionStateException(String executionId, ExecutionStatus currentStatus, String action) {
        super(
                ErrorCode.INVALID_STATE,
                String.format("Cannot %s execution %s in status %s", action, executionId, currentStatus),
                Map.of("executionId", executionId, "status", String.valueOf(currentStatus)));
    }

    public InvalidExecutionStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
