package com.remediation.orchestration;

import com.remediation.circuit.CircuitBreakerService;
import com.remediation.domain.enums.AdmissionDecision;
import com.remediation.domain.enums.ExecutionMode;
import com.remediation.domain.enums.ExecutionOutcome;
import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.enums.RateLimitDecision;
import com.remediation.domain.model.Alert;
import com.remediation.domain.model.BlackoutWindow;
import com.remediation.domain.model.Execution;
import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.ScopeKey;
import com.remediation.domain.model.Trigger;
import com.remediation.exception.InvalidExecutionStateException;
import com.remediation.exception.StateReadException;
import com.remediation.exception.TriggerConfigurationException;
import com.remediation.matching.TriggerCandidate;
import com.remediation.matching.TriggerMatcher;
import com.remediation.ratelimit.RateLimiterService;
import com.remediation.repository.ExecutionHistoryStore;
import com.remediation.repository.TriggerCatalog;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Turns an alert into executions.
 *
 * <p>For every matched candidate, in priority order, the gates are consulted in this order and
 * the first one that refuses decides the recorded status:
 * <ol>
 *   <li>circuit breaker for the scope: CIRCUIT_OPEN (also when breaker state cannot be read)</li>
 *   <li>blackout windows: SKIPPED</li>
 *   <li>rate limiter for the runbook: RATE_LIMITED (also when the window cannot be read or the
 *       runbook's limit has no window)</li>
 *   <li>approval gate: APPROVAL_REQUIRED, waiting for {@link #approve}</li>
 * </ol>
 * A candidate passing all gates is recorded PENDING and queued for the worker pool. One
 * candidate's result never stops the others.
 *
 * <p>A probe slot taken from a HALF_OPEN breaker is handed back whenever the candidate is not
 * dispatched, so the breaker can admit another probe.
 *
 * <p>There is no orchestrator-wide lock. Concurrent alerts only serialize inside the breaker and
 * the rate limiter, per scope and per runbook.
 */
@Service
@EnableConfigurationProperties(ExecutionConfig.class)
public class ExecutionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    private final TriggerMatcher triggerMatcher;
    private final TriggerCatalog triggerCatalog;
    private final CircuitBreakerService circuitBreakerService;
    private final RateLimiterService rateLimiterService;
    private final BlackoutPolicy blackoutPolicy;
    private final ExecutionStateManager stateManager;
    private final ExecutionQueue executionQueue;
    private final ExecutionWorkerPool workerPool;
    private final ExecutionHistoryStore historyStore;
    private final ExecutionConfig config;
    private final Clock clock;

    public ExecutionOrchestrator(
            TriggerMatcher triggerMatcher,
            TriggerCatalog triggerCatalog,
            CircuitBreakerService circuitBreakerService,
            RateLimiterService rateLimiterService,
            BlackoutPolicy blackoutPolicy,
            ExecutionStateManager stateManager,
            ExecutionQueue executionQueue,
            ExecutionWorkerPool workerPool,
            ExecutionHistoryStore historyStore,
            ExecutionConfig config,
            Clock clock) {
        this.triggerMatcher = triggerMatcher;
        this.triggerCatalog = triggerCatalog;
        this.circuitBreakerService = circuitBreakerService;
        this.rateLimiterService = rateLimiterService;
        this.blackoutPolicy = blackoutPolicy;
        this.stateManager = stateManager;
        this.executionQueue = executionQueue;
        this.workerPool = workerPool;
        this.historyStore = historyStore;
        this.config = config;
        this.clock = clock;
    }

    // ========================
    // ADMISSION
    // ========================

    /**
     * Creates one execution per matched candidate, in candidate order.
     *
     * @return the created executions; empty when no trigger matched
     */
    public List<Execution> process(Alert alert) {
        List<TriggerCandidate> candidates = triggerMatcher.findCandidates(alert);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<BlackoutWindow> blackoutWindows = triggerCatalog.listEnabledBlackoutWindows();
        List<Execution> executions = new ArrayList<>(candidates.size());
        for (TriggerCandidate candidate : candidates) {
            executions.add(admit(alert, candidate, blackoutWindows));
        }
        return executions;
    }

    private Execution admit(Alert alert, TriggerCandidate candidate, List<BlackoutWindow> blackoutWindows) {
        Trigger trigger = candidate.trigger();
        Runbook runbook = candidate.runbook();
        ScopeKey scope = scopeFor(alert, runbook);
        Instant now = clock.instant();
        Execution execution = newExecution(alert, candidate, scope, now);
        String executionId = execution.getId();

        AdmissionDecision admission;
        try {
            admission = circuitBreakerService.admit(scope, executionId);
        } catch (StateReadException e) {
            return record(execution, ExecutionStatus.CIRCUIT_OPEN, "Circuit breaker state unavailable: " + e.getMessage());
        }
        if (admission == AdmissionDecision.DENY) {
            return record(execution, ExecutionStatus.CIRCUIT_OPEN, "Circuit breaker open for " + scope);
        }
        boolean probe = admission == AdmissionDecision.ALLOW_AS_PROBE;

        try {
            boolean approvalNeeded = requiresApproval(trigger, runbook);

            Optional<BlackoutWindow> blackout =
                    blackoutPolicy.findActive(blackoutWindows, runbook, !approvalNeeded, now);
            if (blackout.isPresent()) {
                releaseProbe(probe, scope, executionId);
                return record(
                        execution, ExecutionStatus.SKIPPED, "Blackout window active: " + blackout.get().getName());
            }

            RateLimitDecision rateLimit;
            try {
                rateLimit = rateLimiterService.admit(runbook);
            } catch (StateReadException e) {
                releaseProbe(probe, scope, executionId);
                return record(execution, ExecutionStatus.RATE_LIMITED, "Rate limit state unavailable: " + e.getMessage());
            } catch (TriggerConfigurationException e) {
                log.warn("Runbook {} has an invalid rate limit: {}", runbook.getId(), e.getMessage());
                releaseProbe(probe, scope, executionId);
                return record(execution, ExecutionStatus.RATE_LIMITED, "Invalid rate limit: " + e.getMessage());
            }
            if (rateLimit == RateLimitDecision.DENY) {
                releaseProbe(probe, scope, executionId);
                return record(
                        execution, ExecutionStatus.RATE_LIMITED, "Rate limit exceeded for runbook " + runbook.getId());
            }

            if (approvalNeeded) {
                releaseProbe(probe, scope, executionId);
                execution.setApprovalExpiresAt(now.plus(config.getApprovalTtl()));
                Execution awaiting = record(execution, ExecutionStatus.APPROVAL_REQUIRED, null);
                log.info(
                        "Execution {} of runbook {} awaits approval until {}",
                        executionId,
                        runbook.getId(),
                        awaiting.getApprovalExpiresAt());
                return awaiting;
            }

            execution.setProbe(probe);
            Execution pending = record(execution, ExecutionStatus.PENDING, null);
            executionQueue.enqueue(executionId, trigger.getPriority());
            log.info(
                    "Execution {} dispatched: runbook={}, scope={}, trigger={}{}",
                    executionId,
                    runbook.getId(),
                    scope,
                    trigger.getId(),
                    probe ? " (probe)" : "");
            return pending;
        } catch (RuntimeException e) {
            if (probe && !executionQueue.contains(executionId)) {
                releaseProbe(true, scope, executionId);
            }
            throw e;
        }
    }

    /**
     * Approval is needed when the runbook demands it, the trigger demands it, or the runbook is not
     * allowed to run unattended.
     */
    boolean requiresApproval(Trigger trigger, Runbook runbook) {
        return runbook.isApprovalRequired()
                || trigger.getExecutionMode() == ExecutionMode.APPROVAL_REQUIRED
                || !runbook.isAutoExecute();
    }

    ScopeKey scopeFor(Alert alert, Runbook runbook) {
        String scopeType = runbook.getTargetScopeType() != null && !runbook.getTargetScopeType().isBlank()
                ? runbook.getTargetScopeType()
                : config.getDefaultScopeType();
        return new ScopeKey(scopeType, alert.getScope());
    }

    private Execution newExecution(Alert alert, TriggerCandidate candidate, ScopeKey scope, Instant now) {
        Trigger trigger = candidate.trigger();
        Runbook runbook = candidate.runbook();
        return Execution.builder()
                .id(UUID.randomUUID().toString())
                .alertId(alert.getId())
                .alertName(alert.getName())
                .triggerId(trigger.getId())
                .triggerName(trigger.getName())
                .triggerPriority(trigger.getPriority())
                .runbookId(runbook.getId())
                .runbookName(runbook.getName())
                .scopeType(scope.scopeType())
                .scopeId(scope.scopeId())
                .runbookSnapshot(runbook.toBuilder().build())
                .variables(variablesFor(alert, candidate.variables()))
                .createdAt(now)
                .build();
    }

    /** Named groups captured by the trigger, then alert fields and {@code labels.*}. */
    private Map<String, String> variablesFor(Alert alert, Map<String, String> captured) {
        Map<String, String> variables = new LinkedHashMap<>(captured);
        variables.put("alert.id", alert.getId());
        variables.put("alert.name", alert.getName());
        variables.put("alert.severity", alert.getSeverity().name());
        variables.put("alert.scope", alert.getScope());
        if (alert.getSource() != null) {
            variables.put("alert.source", alert.getSource());
        }
        alert.getLabels().forEach((key, value) -> variables.put("labels." + key, value));
        return variables;
    }

    private Execution record(Execution execution, ExecutionStatus status, String detail) {
        execution.setStatus(status);
        execution.setOutcomeDetail(detail);
        if (status.isTerminal()) {
            execution.setCompletedAt(execution.getCreatedAt());
            log.info(
                    "Execution {} of runbook {} on {} recorded {}: {}",
                    execution.getId(),
                    execution.getRunbookId(),
                    execution.getScopeKey(),
                    status,
                    detail);
        }
        return stateManager.create(execution);
    }

    private void releaseProbe(boolean probe, ScopeKey scope, String executionId) {
        if (!probe) {
            return;
        }
        try {
            circuitBreakerService.releaseProbe(scope, executionId);
        } catch (StateReadException e) {
            log.error("Could not release probe {} on {}; it expires after the probe timeout", executionId, scope, e);
        }
    }

    // ========================
    // OPERATOR DECISIONS
    // ========================

    /**
     * Approves an execution awaiting approval and queues it. The breaker is not consulted again.
     */
    public Execution approve(String executionId, String approver) {
        Execution approved = stateManager.approve(executionId, approver);
        executionQueue.enqueue(approved.getId(), approved.getTriggerPriority());
        return approved;
    }

    public Execution reject(String executionId, String actor, String reason) {
        return stateManager.reject(executionId, actor, reason);
    }

    /**
     * Cancels an execution. Not yet started: SKIPPED. Running: FAILED with outcome CANCELLED and the
     * in-flight action interrupted.
     *
     * @throws InvalidExecutionStateException if the execution is already terminal
     */
    public Execution cancel(String executionId, String actor, String reason) {
        Execution execution = stateManager.get(executionId);
        if (execution.getStatus() != ExecutionStatus.RUNNING) {
            try {
                Execution skipped = stateManager.cancelBeforeRun(executionId, actor, reason);
                releaseProbe(skipped.isProbe(), skipped.getScopeKey(), executionId);
                return skipped;
            } catch (InvalidExecutionStateException e) {
                // a worker may have started it meanwhile
                if (stateManager.get(executionId).getStatus() != ExecutionStatus.RUNNING) {
                    throw e;
                }
            }
        }
        return cancelRunning(executionId, actor, reason);
    }

    private Execution cancelRunning(String executionId, String actor, String reason) {
        Execution completed = stateManager.cancelRunning(executionId, actor, reason);
        if (completed.getOutcome() == ExecutionOutcome.CANCELLED) {
            workerPool.cancel(executionId);
        }
        return completed;
    }

    // ========================
    // HOUSEKEEPING
    // ========================

    /**
     * Fails RUNNING executions that have produced no outcome within their stale threshold, usually
     * because the process running them died. Feeds the breaker as TIMED_OUT.
     *
     * <p>The threshold of an execution is the larger of {@code staleRunningThreshold} and its runbook
     * timeout plus {@code staleTimeoutMargin}. Actions still in flight in this process are left to
     * the worker's own time limit.
     *
     * @return number of executions failed
     */
    public int reconcileStaleExecutions() {
        Instant now = clock.instant();
        int reconciled = 0;
        for (Execution execution : historyStore.findByStatus(ExecutionStatus.RUNNING)) {
            if (workerPool.isInFlight(execution.getId())) {
                continue;
            }
            Duration threshold = staleThresholdFor(execution);
            if (execution.getStartedAt() != null && execution.getStartedAt().isAfter(now.minus(threshold))) {
                continue;
            }
            Execution completed = stateManager.complete(
                    execution.getId(),
                    ExecutionOutcome.TIMED_OUT,
                    "No outcome within " + threshold.toMinutes() + "m, marked stale");
            if (completed.getOutcome() == ExecutionOutcome.TIMED_OUT) {
                reconciled++;
            }
        }
        if (reconciled > 0) {
            log.warn("Reconciled {} stale running execution(s)", reconciled);
        }
        return reconciled;
    }

    Duration staleThresholdFor(Execution execution) {
        Runbook runbook = execution.getRunbookSnapshot();
        if (runbook == null || runbook.getTimeoutSeconds() == null || runbook.getTimeoutSeconds() <= 0) {
            return config.getStaleRunningThreshold();
        }
        Duration runbookBound = Duration.ofSeconds(runbook.getTimeoutSeconds()).plus(config.getStaleTimeoutMargin());
        return runbookBound.compareTo(config.getStaleRunningThreshold()) > 0
                ? runbookBound
                : config.getStaleRunningThreshold();
    }

    /**
     * Queues PENDING executions left over from a previous run.
     *
     * @return number of executions queued
     */
    public int requeuePendingExecutions() {
        int requeued = 0;
        for (Execution execution : historyStore.findByStatus(ExecutionStatus.PENDING)) {
            if (executionQueue.enqueue(execution.getId(), execution.getTriggerPriority())) {
                requeued++;
            }
        }
        if (requeued > 0) {
            log.info("Re-queued {} pending execution(s)", requeued);
        }
        return requeued;
    }

    /**
     * Skips executions whose approval window has passed.
     *
     * @return number of approvals expired
     */
    public int expireStaleApprovals() {
        Instant now = clock.instant();
        int expired = 0;
        for (Execution execution : historyStore.findByStatus(ExecutionStatus.APPROVAL_REQUIRED)) {
            if (execution.getApprovalExpiresAt() == null || now.isBefore(execution.getApprovalExpiresAt())) {
                continue;
            }
            if (stateManager.expireApproval(execution.getId()).isPresent()) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} overdue approval(s)", expired);
        }
        return expired;
    }
}
