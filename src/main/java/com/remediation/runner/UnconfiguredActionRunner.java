package com.remediation.runner;

import com.remediation.domain.model.ActionResult;
import com.remediation.domain.model.ExecutionTarget;
import com.remediation.domain.model.Runbook;
import com.remediation.exception.ActionTransportException;

/**
 * Stand-in used when no execution agent is configured. Every dispatch fails as a transport
 * error, so executions end FAILED instead of silently succeeding.
 */
public class UnconfiguredActionRunner implements ActionRunner {

    @Override
    public ActionResult execute(Runbook runbook, ExecutionTarget target) {
        throw new ActionTransportException(
                "No action runner configured (set remediation.action-runner.http.base-url); runbook "
                        + runbook.getId() + " not executed");
    }
}
