package com.remediation.orchestration;

import lombok.Builder;
import lombok.Data;

/**
 * Entry of the {@link ExecutionQueue}: the execution id plus its ordering keys.
 *
 * <p>The execution itself is re-read from history when a worker takes the entry, so an
 * execution cancelled while queued is simply skipped.
 */
@Data
@Builder
public class QueuedExecution {

    private String executionId;
    private int priority;
    private long sequenceNumber;
    private long enqueuedAt;
}
