package com.remediation.repository;

import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.model.Execution;
import java.util.List;
import java.util.Optional;

/**
 * Durable history of executions. The core creates a record once and updates it on every
 * status transition; nothing is ever deleted.
 */
public interface ExecutionHistoryStore {

    Execution create(Execution execution);

    Execution update(Execution execution);

    Optional<Execution> findById(String executionId);

    List<Execution> findByStatus(ExecutionStatus status);
}
