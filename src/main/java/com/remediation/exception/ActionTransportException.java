package com.remediation.exception;

/**
 * The action runner could not start the action at all (unreachable target, agent down).
 * Recorded as a FAILED execution and counted by the circuit breaker like any other failure.
 */
public class ActionTransportException extends BaseException {

    public ActionTransportException(String message) {
        super(ErrorCode.EXECUTION_TRANSPORT_ERROR, message);
    }

    public ActionTransportException(String message, Throwable cause) {
        super(ErrorCode.EXECUTION_TRANSPORT_ERROR, message, cause);
    }
}
