package com.remediation.repository;

import com.remediation.domain.model.BlackoutWindow;
import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.Trigger;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to operator-maintained configuration: triggers, runbooks and blackout windows.
 *
 * <p>Implementations wrap storage failures in {@link com.remediation.exception.StateReadException}.
 */
public interface TriggerCatalog {

    List<Trigger> listEnabledTriggers();

    Optional<Runbook> getRunbook(Long runbookId);

    List<BlackoutWindow> listEnabledBlackoutWindows();
}
