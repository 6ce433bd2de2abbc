package com.remediation.exception;

public class InvalidAlertException extends BaseException {

    public InvalidAlertException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
