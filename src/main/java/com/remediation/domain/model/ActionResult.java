package com.remediation.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome reported by the action runner for an action that started.
 */
@Value
@Builder
public class ActionResult {

    boolean success;
    String detail;

    public static ActionResult success(String detail) {
        return ActionResult.builder().success(true).detail(detail).build();
    }

    public static ActionResult failure(String detail) {
        return ActionResult.builder().success(false).detail(detail).build();
    }
}
