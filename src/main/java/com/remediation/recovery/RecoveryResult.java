package com.remediation.recovery;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the startup recovery sequence.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    private int staleExecutionsFailed;
    private int pendingExecutionsRequeued;
    private int approvalsExpired;
}
