package com.remediation.orchestration;

import com.remediation.circuit.CircuitBreakerService;
import com.remediation.domain.enums.ExecutionOutcome;
import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.model.Execution;
import com.remediation.event.EventPublisherHelper;
import com.remediation.event.ExecutionEventType;
import com.remediation.exception.InvalidExecutionStateException;
import com.remediation.exception.ResourceNotFoundException;
import com.remediation.exception.StateReadException;
import com.remediation.repository.ExecutionHistoryStore;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sole owner of execution status transitions.
 *
 * <p>Every transition follows the same steps under a per-execution monitor: re-read the
 * execution, check its current status, mutate, persist, publish an
 * {@link com.remediation.event.ExecutionEvent}. Terminal executions are never touched again.
 *
 * <p>When an execution that actually ran reaches a terminal status, its outcome is reported to
 * the {@link CircuitBreakerService} exactly once, from here and nowhere else.
 */
@Component
public class ExecutionStateManager {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStateManager.class);

    private static final Set<ExecutionStatus> CANCELLABLE_BEFORE_RUN =
            EnumSet.of(ExecutionStatus.APPROVAL_REQUIRED, ExecutionStatus.PENDING);

    private final ExecutionHistoryStore historyStore;
    private final CircuitBreakerService circuitBreakerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ConcurrentMap<String, Object> executionLocks = new ConcurrentHashMap<>();

    public ExecutionStateManager(
            ExecutionHistoryStore historyStore,
            CircuitBreakerService circuitBreakerService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.historyStore = historyStore;
        this.circuitBreakerService = circuitBreakerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public Execution create(Execution execution) {
        Execution created = historyStore.create(execution);
        eventPublisherHelper.publishExecutionCreated(this, created);
        log.debug("Execution {} created with status {}", created.getId(), created.getStatus());
        return created;
    }

    public Execution get(String executionId) {
        return historyStore
                .findById(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("Execution", executionId));
    }

    // ========================
    // DISPATCH
    // ========================

    /**
     * PENDING to RUNNING, taken by a worker right before invoking the action.
     *
     * @return the running execution, or empty if it is no longer PENDING (cancelled, rejected)
     */
    public Optional<Execution> markRunning(String executionId) {
        synchronized (lockFor(executionId)) {
            Optional<Execution> found = historyStore.findById(executionId);
            if (found.isEmpty()) {
                log.warn("Queued execution {} not found in history, dropping", executionId);
                return Optional.empty();
            }

            Execution execution = found.get();
            if (execution.getStatus() != ExecutionStatus.PENDING) {
                log.debug("Execution {} is {}, not starting", executionId, execution.getStatus());
                return Optional.empty();
            }

            execution.setStatus(ExecutionStatus.RUNNING);
            execution.setStartedAt(clock.instant());
            Execution saved = historyStore.update(execution);
            eventPublisherHelper.publishExecutionTransition(
                    this, saved, ExecutionEventType.STARTED, ExecutionStatus.PENDING);
            return Optional.of(saved);
        }
    }

    /**
     * RUNNING to SUCCEEDED or FAILED with the given outcome, then feeds the circuit breaker.
     *
     * <p>A no-op returning the current execution when it is no longer RUNNING, which happens when a
     * cancel or the stale sweep finished it first.
     */
    public Execution complete(String executionId, ExecutionOutcome outcome, String detail) {
        return finish(executionId, outcome, detail, null);
    }

    /**
     * Operator cancel of a RUNNING execution: FAILED with outcome CANCELLED, neutral for the breaker.
     * Interrupting the action itself is up to the caller.
     */
    public Execution cancelRunning(String executionId, String actor, String reason) {
        return finish(executionId, ExecutionOutcome.CANCELLED, describe("Cancelled", actor, reason), actor);
    }

    private Execution finish(String executionId, ExecutionOutcome outcome, String detail, String actor) {
        Execution saved;
        synchronized (lockFor(executionId)) {
            Execution execution = get(executionId);
            if (execution.getStatus() != ExecutionStatus.RUNNING) {
                log.debug(
                        "Execution {} already {}, ignoring late outcome {}",
                        executionId,
                        execution.getStatus(),
                        outcome);
                return execution;
            }

            execution.setStatus(
                    outcome == ExecutionOutcome.SUCCEEDED ? ExecutionStatus.SUCCEEDED : ExecutionStatus.FAILED);
            execution.setOutcome(outcome);
            execution.setOutcomeDetail(detail);
            execution.setCompletedAt(clock.instant());
            if (actor != null) {
                execution.setDecidedBy(actor);
            }
            saved = historyStore.update(execution);
            executionLocks.remove(executionId);
        }

        eventPublisherHelper.publishExecutionTransition(
                this,
                saved,
                outcome == ExecutionOutcome.CANCELLED ? ExecutionEventType.CANCELLED : ExecutionEventType.COMPLETED,
                ExecutionStatus.RUNNING);
        log.info("Execution {} on {} finished {} ({})", executionId, saved.getScopeKey(), saved.getStatus(), outcome);

        reportOutcome(saved);
        return saved;
    }

    private void reportOutcome(Execution execution) {
        try {
            circuitBreakerService.recordOutcome(execution.getScopeKey(), execution.getId(), execution.getOutcome());
        } catch (StateReadException e) {
            log.error(
                    "Could not record outcome {} of execution {} on breaker {}",
                    execution.getOutcome(),
                    execution.getId(),
                    execution.getScopeKey(),
                    e);
        }
    }

    // ========================
    // OPERATOR DECISIONS
    // ========================

    /**
     * APPROVAL_REQUIRED to PENDING. An approval arriving after {@code approvalExpiresAt} expires the
     * execution instead and fails.
     *
     * @throws InvalidExecutionStateException if not awaiting approval or the approval window passed
     */
    public Execution approve(String executionId, String approver) {
        synchronized (lockFor(executionId)) {
            Execution execution = get(executionId);
            requireStatus(execution, ExecutionStatus.APPROVAL_REQUIRED, "approve");

            Instant now = clock.instant();
            if (execution.getApprovalExpiresAt() != null && !now.isBefore(execution.getApprovalExpiresAt())) {
                skip(execution, "Approval expired at " + execution.getApprovalExpiresAt(), null, ExecutionEventType.EXPIRED);
                throw new InvalidExecutionStateException(
                        "Approval for execution " + executionId + " expired at " + execution.getApprovalExpiresAt());
            }

            execution.setStatus(ExecutionStatus.PENDING);
            execution.setDecidedBy(approver);
            Execution saved = historyStore.update(execution);
            eventPublisherHelper.publishExecutionTransition(
                    this, saved, ExecutionEventType.APPROVED, ExecutionStatus.APPROVAL_REQUIRED);
            log.info("Execution {} approved by {}", executionId, approver);
            return saved;
        }
    }

    public Execution reject(String executionId, String actor, String reason) {
        synchronized (lockFor(executionId)) {
            Execution execution = get(executionId);
            requireStatus(execution, ExecutionStatus.APPROVAL_REQUIRED, "reject");
            Execution saved = skip(execution, describe("Rejected", actor, reason), actor, ExecutionEventType.REJECTED);
            log.info("Execution {} rejected by {}: {}", executionId, actor, reason);
            return saved;
        }
    }

    /**
     * Cancels an execution that has not started yet (APPROVAL_REQUIRED or PENDING) by skipping it.
     * RUNNING executions are cancelled through {@link #complete} with outcome CANCELLED.
     */
    public Execution cancelBeforeRun(String executionId, String actor, String reason) {
        synchronized (lockFor(executionId)) {
            Execution execution = get(executionId);
            if (!CANCELLABLE_BEFORE_RUN.contains(execution.getStatus())) {
                throw new InvalidExecutionStateException(executionId, execution.getStatus(), "cancel");
            }
            Execution saved = skip(execution, describe("Cancelled", actor, reason), actor, ExecutionEventType.CANCELLED);
            log.info("Execution {} cancelled by {} before running", executionId, actor);
            return saved;
        }
    }

    /**
     * Skips an approval whose window has passed. No-op for executions no longer awaiting approval.
     */
    public Optional<Execution> expireApproval(String executionId) {
        synchronized (lockFor(executionId)) {
            Execution execution = get(executionId);
            if (execution.getStatus() != ExecutionStatus.APPROVAL_REQUIRED) {
                return Optional.empty();
            }
            Execution saved = skip(
                    execution, "Approval expired at " + execution.getApprovalExpiresAt(), null, ExecutionEventType.EXPIRED);
            log.info("Execution {} approval expired", executionId);
            return Optional.of(saved);
        }
    }

    // ========================
    // INTERNALS
    // ========================

    private Execution skip(Execution execution, String detail, String actor, ExecutionEventType eventType) {
        ExecutionStatus previous = execution.getStatus();
        execution.setStatus(ExecutionStatus.SKIPPED);
        execution.setOutcomeDetail(detail);
        execution.setCompletedAt(clock.instant());
        if (actor != null) {
            execution.setDecidedBy(actor);
        }
        Execution saved = historyStore.update(execution);
        executionLocks.remove(execution.getId());
        eventPublisherHelper.publishExecutionTransition(this, saved, eventType, previous);
        return saved;
    }

    private void requireStatus(Execution execution, ExecutionStatus expected, String action) {
        if (execution.getStatus() != expected) {
            throw new InvalidExecutionStateException(execution.getId(), execution.getStatus(), action);
        }
    }

    private static String describe(String verb, String actor, String reason) {
        String text = verb + " by " + (actor != null ? actor : "unknown");
        return reason == null || reason.isBlank() ? text : text + ": " + reason;
    }

    private Object lockFor(String executionId) {
        return executionLocks.computeIfAbsent(executionId, k -> new Object());
    }
}
