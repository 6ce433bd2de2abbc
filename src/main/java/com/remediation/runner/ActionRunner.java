package com.remediation.runner;

import com.remediation.domain.model.ActionResult;
import com.remediation.domain.model.ExecutionTarget;
import com.remediation.domain.model.Runbook;

/**
 * Runs a runbook's action against a target.
 *
 * <p>Implementations block until the action finishes and report the result. They throw
 * {@link com.remediation.exception.ActionTransportException} when the action could not be started.
 * The caller bounds the call with the runbook timeout and interrupts it on timeout or cancel.
 */
public interface ActionRunner {

    ActionResult execute(Runbook runbook, ExecutionTarget target);
}
