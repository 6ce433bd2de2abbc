package com.remediation.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),
    INVALID_STATE("INVALID_STATE"),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR"),
    STATE_READ_ERROR("STATE_READ_ERROR"),
    EXECUTION_TRANSPORT_ERROR("EXECUTION_TRANSPORT_ERROR"),
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String code;
}
