package com.remediation.exception;

/**
 * Circuit breaker or rate limiter state could not be read or written.
 * Callers treat it as a denial unless fail-open is explicitly configured.
 */
public class StateReadException extends BaseException {

    public StateReadException(String message, Throwable cause) {
        super(ErrorCode.STATE_READ_ERROR, message, cause);
    }
}
