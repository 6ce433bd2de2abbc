package com.remediation.service;

import com.remediation.circuit.CircuitBreakerService;
import com.remediation.domain.enums.AlertStatus;
import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.model.Alert;
import com.remediation.domain.model.CircuitBreakerState;
import com.remediation.domain.model.Execution;
import com.remediation.domain.model.RateLimitWindow;
import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.ScopeKey;
import com.remediation.exception.InvalidAlertException;
import com.remediation.exception.ResourceNotFoundException;
import com.remediation.orchestration.ExecutionConfig;
import com.remediation.orchestration.ExecutionOrchestrator;
import com.remediation.orchestration.ExecutionStateManager;
import com.remediation.ratelimit.RateLimiterService;
import com.remediation.repository.ExecutionHistoryStore;
import com.remediation.repository.TriggerCatalog;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point of the remediation core for the surrounding application (webhook receiver, operator
 * API, scheduler).
 *
 * <p>Validates incoming alerts and delegates to the {@link ExecutionOrchestrator}. Resolved alerts
 * are ignored unless {@code remediation.execution.process-resolved-alerts} is set.
 */
@Service
public class RemediationService {

    private static final Logger log = LoggerFactory.getLogger(RemediationService.class);

    private final ExecutionOrchestrator executionOrchestrator;
    private final ExecutionStateManager executionStateManager;
    private final ExecutionHistoryStore executionHistoryStore;
    private final CircuitBreakerService circuitBreakerService;
    private final RateLimiterService rateLimiterService;
    private final TriggerCatalog triggerCatalog;
    private final ExecutionConfig executionConfig;
    private final Executor alertExecutor;
    private final Clock clock;

    public RemediationService(
            ExecutionOrchestrator executionOrchestrator,
            ExecutionStateManager executionStateManager,
            ExecutionHistoryStore executionHistoryStore,
            CircuitBreakerService circuitBreakerService,
            RateLimiterService rateLimiterService,
            TriggerCatalog triggerCatalog,
            ExecutionConfig executionConfig,
            @Qualifier("alertExecutor") Executor alertExecutor,
            Clock clock) {
        this.executionOrchestrator = executionOrchestrator;
        this.executionStateManager = executionStateManager;
        this.executionHistoryStore = executionHistoryStore;
        this.circuitBreakerService = circuitBreakerService;
        this.rateLimiterService = rateLimiterService;
        this.triggerCatalog = triggerCatalog;
        this.executionConfig = executionConfig;
        this.alertExecutor = alertExecutor;
        this.clock = clock;
    }

    // ========================
    // ALERT INTAKE
    // ========================

    /**
     * Processes an alert synchronously: matching, gating and recording happen before returning.
     * Dispatched executions are returned PENDING; workers run them afterwards.
     *
     * @return one execution per matched candidate, in priority order; empty when nothing matched
     * @throws InvalidAlertException if name, severity or scope is missing
     */
    public List<Execution> ingestAlert(Alert alert) {
        Alert validated = validate(alert);
        if (validated.getStatus() == AlertStatus.RESOLVED && !executionConfig.isProcessResolvedAlerts()) {
            log.debug("Ignoring resolved alert {} ({})", validated.getId(), validated.getName());
            return List.of();
        }

        log.debug(
                "Processing alert {}: name={}, severity={}, scope={}",
                validated.getId(),
                validated.getName(),
                validated.getSeverity(),
                validated.getScope());
        return executionOrchestrator.process(validated);
    }

    /**
     * Processes an alert on the {@code alertExecutor}. Alerts submitted this way never wait on each
     * other except inside per-scope and per-runbook admission.
     */
    public CompletableFuture<List<Execution>> submitAlert(Alert alert) {
        Alert validated = validate(alert);
        return CompletableFuture.supplyAsync(() -> ingestAlert(validated), alertExecutor);
    }

    private Alert validate(Alert alert) {
        if (alert == null) {
            throw new InvalidAlertException("Alert is required");
        }
        if (alert.getName() == null || alert.getName().isBlank()) {
            throw new InvalidAlertException("Alert name is required");
        }
        if (alert.getSeverity() == null) {
            throw new InvalidAlertException("Alert severity is required");
        }
        if (alert.getScope() == null || alert.getScope().isBlank()) {
            throw new InvalidAlertException("Alert scope is required");
        }

        if (alert.getId() != null && alert.getReceivedAt() != null) {
            return alert;
        }
        return alert.toBuilder()
                .id(alert.getId() != null ? alert.getId() : UUID.randomUUID().toString())
                .receivedAt(alert.getReceivedAt() != null ? alert.getReceivedAt() : clock.instant())
                .build();
    }

    // ========================
    // OPERATOR ACTIONS
    // ========================

    public Execution approve(String executionId, String approver) {
        return executionOrchestrator.approve(executionId, approver);
    }

    public Execution reject(String executionId, String actor, String reason) {
        return executionOrchestrator.reject(executionId, actor, reason);
    }

    public Execution cancel(String executionId, String actor, String reason) {
        return executionOrchestrator.cancel(executionId, actor, reason);
    }

    public Execution getExecutionStatus(String executionId) {
        return executionStateManager.get(executionId);
    }

    /** Executions waiting for an operator, oldest first. */
    public List<Execution> listPendingApprovals() {
        return executionHistoryStore.findByStatus(ExecutionStatus.APPROVAL_REQUIRED).stream()
                .sorted(Comparator.comparing(Execution::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    // ========================
    // CIRCUIT BREAKERS
    // ========================

    public void openCircuit(ScopeKey scope, String reason) {
        circuitBreakerService.forceOpen(scope, reason);
    }

    public void resetCircuit(ScopeKey scope) {
        circuitBreakerService.reset(scope);
    }

    public Optional<CircuitBreakerState> getCircuitState(ScopeKey scope) {
        return circuitBreakerService.getState(scope);
    }

    // ========================
    // RATE LIMITS
    // ========================

    /**
     * Executions counted in the runbook's current window, its limit and when the window ends.
     *
     * @return empty when the runbook is not rate limited
     * @throws ResourceNotFoundException if the runbook does not exist
     */
    public Optional<RateLimitWindow> getRateLimitUsage(Long runbookId) {
        Runbook runbook = triggerCatalog
                .getRunbook(runbookId)
                .orElseThrow(() -> new ResourceNotFoundException("Runbook", String.valueOf(runbookId)));
        return rateLimiterService.getUsage(runbook);
    }
}
